package org.muma.kvlite.config;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (kvlite.properties) > 默认值
 * <p>
 * 构造完成后不可变，CONFIG GET 和启动时的 RDB 加载都读这里。
 */
@Getter
public class KvLiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KvLiteConfig.class);

    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_CONFIG_FILE = "kvlite.properties";

    private final int port;
    private final String dir;
    private final String dbFilename;

    public KvLiteConfig(int port, String dir, String dbFilename) {
        this.port = port;
        this.dir = dir == null ? "" : dir;
        this.dbFilename = dbFilename == null ? "" : dbFilename;
    }

    public static KvLiteConfig defaults() {
        return new KvLiteConfig(DEFAULT_PORT, "", "");
    }

    /**
     * dir 和 dbfilename 都配置了才会尝试加载 RDB
     */
    public boolean hasSnapshot() {
        return !dir.isEmpty() && !dbFilename.isEmpty();
    }

    public Path snapshotPath() {
        return Paths.get(dir, dbFilename);
    }

    // --- Loading Logic ---

    public static KvLiteConfig load(String[] args) {
        return load(args, System.getenv());
    }

    static KvLiteConfig load(String[] args, Map<String, String> env) {
        Map<String, String> flags = parseArgs(args);

        // 1. 配置文件
        Properties props = loadProperties(flags.getOrDefault("config", DEFAULT_CONFIG_FILE));
        int port = getInt(props.getProperty("server.port"), DEFAULT_PORT, "server.port");
        String dir = props.getProperty("dir", "");
        String dbFilename = props.getProperty("dbfilename", "");

        // 2. Env Vars Override
        port = getInt(env.get("KVLITE_PORT"), port, "KVLITE_PORT");
        dir = env.getOrDefault("KVLITE_DIR", dir);
        dbFilename = env.getOrDefault("KVLITE_DBFILENAME", dbFilename);

        // 3. 命令行参数
        port = getInt(flags.get("port"), port, "--port");
        dir = flags.getOrDefault("dir", dir);
        dbFilename = flags.getOrDefault("dbfilename", dbFilename);

        KvLiteConfig config = new KvLiteConfig(port, dir, dbFilename);
        log.info("KvLiteConfig initialized: {}", config);
        return config;
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> flags = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                log.warn("Ignoring unexpected argument: {}", arg);
                continue;
            }
            String name = arg.substring(2);
            if (!isKnownFlag(name)) {
                log.warn("Ignoring unknown flag: {}", arg);
                continue;
            }
            if (i + 1 >= args.length) {
                log.warn("Flag {} has no value, ignored", arg);
                continue;
            }
            flags.put(name, args[++i]);
        }
        return flags;
    }

    private static boolean isKnownFlag(String name) {
        return switch (name) {
            case "port", "dir", "dbfilename", "config" -> true;
            default -> false;
        };
    }

    private static Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = KvLiteConfig.class.getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                // 尝试作为文件系统路径加载
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private static int getInt(String value, int defaultValue, String source) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer '{}' for {}, keeping {}", value, source, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", dir='" + dir + "', dbfilename='" + dbFilename + "'}";
    }
}

package org.muma.kvlite.rdb;

import org.muma.kvlite.config.KvLiteConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 启动时加载 RDB 文件。
 * 文件缺失或解析失败都只记日志，返回对应的 {@link SnapshotLoadResult}，由调用方决定以空 store 启动。
 */
public class RdbLoader {

    private static final Logger log = LoggerFactory.getLogger(RdbLoader.class);

    private final KvLiteConfig config;
    private final RdbParser parser = new RdbParser();

    public RdbLoader(KvLiteConfig config) {
        this.config = config;
    }

    public SnapshotLoadResult load() {
        if (!config.hasSnapshot()) {
            log.info("No snapshot configured (dir='{}', dbfilename='{}'), starting empty", config.getDir(), config.getDbFilename());
            return SnapshotLoadResult.skipped("snapshot not configured");
        }

        Path path = config.snapshotPath();
        if (!Files.isRegularFile(path)) {
            log.info("Snapshot file {} does not exist, starting empty", path);
            return SnapshotLoadResult.skipped("file not found: " + path);
        }

        log.info("Loading RDB file: {}", path);
        long start = System.currentTimeMillis();
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            RdbSnapshot snapshot = parser.parse(in);
            long duration = System.currentTimeMillis() - start;
            log.info("RDB loaded. Version: {}, Keys: {}, Duration: {} ms",
                    snapshot.version(), snapshot.records().size(), duration);
            return SnapshotLoadResult.loaded(snapshot, path.toString());
        } catch (IOException e) {
            // RDB 加载失败只打日志，不阻断启动
            log.error("Failed to load RDB file {}, starting with an empty store", path, e);
            return SnapshotLoadResult.failed(path.toString(), e);
        }
    }
}

package org.muma.kvlite.command;

import org.muma.kvlite.command.impl.connection.EchoCommand;
import org.muma.kvlite.command.impl.connection.PingCommand;
import org.muma.kvlite.command.impl.connection.QuitCommand;
import org.muma.kvlite.command.impl.key.KeysCommand;
import org.muma.kvlite.command.impl.server.ConfigCommand;
import org.muma.kvlite.command.impl.string.GetCommand;
import org.muma.kvlite.command.impl.string.SetCommand;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发
 * 全局单例，被所有连接共享；命令实现本身无状态，连接状态放在 {@link ClientContext}。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final KeyValueStore store;
    private final KvLiteConfig config;

    public CommandDispatcher(KeyValueStore store, KvLiteConfig config) {
        this.store = store;
        this.config = config;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按类别注册
     */
    private void initCommandRegistry() {
        registerConnectionCommands();
        registerStringCommands();
        registerGenericCommands();
        registerServerCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerConnectionCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("QUIT", new QuitCommand());
    }

    private void registerStringCommands() {
        commandMap.put("SET", new SetCommand());
        commandMap.put("GET", new GetCommand());
    }

    private void registerGenericCommands() {
        commandMap.put("KEYS", new KeysCommand());
    }

    private void registerServerCommands() {
        commandMap.put("CONFIG", new ConfigCommand(config));
    }

    /**
     * 核心分发逻辑
     *
     * @return 回复内容；null 表示不回复 (未知命令、参数校验失败)
     */
    public RedisMessage dispatch(String commandName, RedisArray args, ClientContext context) {
        // 1. 查找命令
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.debug("Ignoring unknown command: {}", commandName);
            return null;
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(store, args, context);

            // 记录慢日志 (超过 10ms)
            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }

            return response;

        } catch (CommandValidationException e) {
            // 预期内的参数错误：记录后跳过，不回复，连接保持
            log.warn("Command rejected: {} from {} - {}", cmdUpper, context.getRemoteAddress(), e.getMessage());
            return null;

        } catch (RuntimeException e) {
            // 意料之外的系统错误 (如 NPE)
            log.error("Internal error processing command: {}", cmdUpper, e);
            return null;
        }
    }
}

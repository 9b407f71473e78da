package org.muma.kvlite.command.impl.server;

import org.muma.kvlite.command.CommandValidationException;
import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.config.KvLiteConfig;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * CONFIG GET parameter
 * 只暴露 dir 和 dbfilename 两个启动参数。
 */
public class ConfigCommand implements RedisCommand {

    private final KvLiteConfig config;
    private final Map<String, Function<KvLiteConfig, String>> parameters = new LinkedHashMap<>();

    public ConfigCommand(KvLiteConfig config) {
        this.config = config;
        parameters.put("dir", KvLiteConfig::getDir);
        parameters.put("dbfilename", KvLiteConfig::getDbFilename);
    }

    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 3) throw errorArgs("config");

        String subCommand = argString(args, 1);
        if (!"GET".equalsIgnoreCase(subCommand)) {
            throw new CommandValidationException("unsupported CONFIG subcommand '" + subCommand + "'");
        }

        String name = argString(args, 2).toLowerCase(Locale.ROOT);
        Function<KvLiteConfig, String> getter = parameters.get(name);
        if (getter == null) {
            throw new CommandValidationException("unknown CONFIG parameter '" + name + "'");
        }

        return new RedisArray(new RedisMessage[]{
                new BulkString(name),
                new BulkString(getter.apply(config))
        });
    }
}

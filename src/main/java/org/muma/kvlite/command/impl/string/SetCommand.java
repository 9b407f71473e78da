package org.muma.kvlite.command.impl.string;

import org.muma.kvlite.command.CommandValidationException;
import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

/**
 * SET key value [PX milliseconds]
 */
public class SetCommand implements RedisCommand {

    // 不带 PX 时视为永不过期
    private static final long NO_TTL = Long.MAX_VALUE;

    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        int argc = args.size();
        if (argc != 3 && argc != 5) throw errorArgs("set");

        String key = argString(args, 1);
        byte[] value = argBytes(args, 2);

        long ttlMillis = NO_TTL;
        if (argc == 5) {
            String opt = argString(args, 3);
            if (!"PX".equalsIgnoreCase(opt)) {
                throw new CommandValidationException("syntax error: unsupported SET option '" + opt + "'");
            }
            ttlMillis = parseMillis(argString(args, 4));
        }

        store.set(key, value, ttlMillis);
        return SimpleString.OK;
    }

    private long parseMillis(String raw) {
        long millis;
        try {
            millis = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new CommandValidationException("value is not an integer or out of range: '" + raw + "'");
        }
        if (millis < 0) {
            throw new CommandValidationException("invalid expire time in 'set' command: " + millis);
        }
        return millis;
    }
}

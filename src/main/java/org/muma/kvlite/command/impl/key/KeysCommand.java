package org.muma.kvlite.command.impl.key;

import org.muma.kvlite.command.CommandValidationException;
import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;
import org.muma.kvlite.store.impl.ExpiringMemoryStore;

import java.util.List;

/**
 * KEYS *
 * 只支持全量匹配，返回所有未过期的 key；没有 key 时回复 Null Array。
 */
public class KeysCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 2) throw errorArgs("keys");

        String pattern = argString(args, 1);
        if (!ExpiringMemoryStore.MATCH_ALL.equals(pattern)) {
            throw new CommandValidationException("unsupported KEYS pattern '" + pattern + "', only '*' is supported");
        }

        List<String> keys = store.keys(pattern);
        if (keys.isEmpty()) {
            return new RedisArray(null);
        }
        return RedisArray.of(keys.stream().map(BulkString::new).toList());
    }
}

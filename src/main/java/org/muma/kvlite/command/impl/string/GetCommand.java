package org.muma.kvlite.command.impl.string;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

public class GetCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 2) throw errorArgs("get");

        // 注意：这里 store.get 可能会触发惰性删除
        byte[] value = store.get(argString(args, 1));
        return new BulkString(value); // value 为 null 时即 Nil
    }
}

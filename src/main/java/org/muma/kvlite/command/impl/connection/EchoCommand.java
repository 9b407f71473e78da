package org.muma.kvlite.command.impl.connection;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

public class EchoCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 2) throw errorArgs("echo");
        return new BulkString(argBytes(args, 1));
    }
}

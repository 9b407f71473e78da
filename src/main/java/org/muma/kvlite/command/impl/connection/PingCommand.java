package org.muma.kvlite.command.impl.connection;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

public class PingCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 1) throw errorArgs("ping");
        return SimpleString.PONG;
    }
}

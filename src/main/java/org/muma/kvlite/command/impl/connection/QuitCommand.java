package org.muma.kvlite.command.impl.connection;

import org.muma.kvlite.command.RedisCommand;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.protocol.SimpleString;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

public class QuitCommand implements RedisCommand {
    @Override
    public RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context) {
        if (args.size() != 1) throw errorArgs("quit");
        // 先回复 OK，由 handler 在写出后关闭连接
        context.requestClose();
        return SimpleString.OK;
    }
}

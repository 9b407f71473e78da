package org.muma.kvlite.command;

import org.muma.kvlite.protocol.BulkString;
import org.muma.kvlite.protocol.RedisArray;
import org.muma.kvlite.protocol.RedisMessage;
import org.muma.kvlite.server.ClientContext;
import org.muma.kvlite.store.KeyValueStore;

public interface RedisCommand {

    /**
     * 执行命令。args 的第 0 个元素是命令名，所有元素都已保证是非 null 的 BulkString。
     *
     * @return 回复内容，返回 null 表示不回复
     * @throws CommandValidationException 参数不合法
     */
    RedisMessage execute(KeyValueStore store, RedisArray args, ClientContext context);

    /**
     * 辅助工具：快速构建参数个数错误
     */
    default CommandValidationException errorArgs(String cmd) {
        return new CommandValidationException("wrong number of arguments for '" + cmd + "' command");
    }

    default String argString(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).asString();
    }

    default byte[] argBytes(RedisArray args, int index) {
        return ((BulkString) args.elements()[index]).content();
    }
}

package org.muma.kvlite.command;

/**
 * 命令参数校验失败 (参数个数、选项格式等)。
 * 由 {@link CommandDispatcher} 捕获并记录日志，不回复客户端，连接保持。
 */
public class CommandValidationException extends RuntimeException {

    public CommandValidationException(String message) {
        super(message);
    }
}

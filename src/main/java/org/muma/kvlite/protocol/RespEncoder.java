package org.muma.kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        write(out, msg);
    }

    // 递归写入：数组元素同样走这里
    static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeDecimal(out, i.value());
            out.writeBytes(CRLF);
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeDecimal(out, b.content().length);
                out.writeBytes(CRLF);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.isNull()) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeDecimal(out, a.elements().length);
                out.writeBytes(CRLF);
                for (RedisMessage element : a.elements()) {
                    write(out, element);
                }
            }
        }
    }

    private static void writeDecimal(ByteBuf out, long value) {
        out.writeBytes(String.valueOf(value).getBytes(StandardCharsets.US_ASCII));
    }
}

package org.muma.kvlite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时抛出 Signal 并回滚读索引，
 * 等下一批字节到达后从帧头重新解析。
 * <p>
 * 每次回放都会重新走一遍帧头，所以任何按声明长度分配的内存，都必须等对应字节真正到齐之后再分配。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 与 Redis 的 proto-max-bulk-len 默认值一致 (512MB)
    private static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    private static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    private static final int INITIAL_ARRAY_CAPACITY = 16;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(readMessage(in));
    }

    // 数组元素递归调用
    private RedisMessage readMessage(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLength(in));
            case DOLLAR_BYTE -> readBulkString(in);
            case ASTERISK_BYTE -> readArray(in);
            default -> throw new IllegalStateException("Unknown RESP type byte: " + (char) type);
        };
    }

    // $<length>\r\n<data>\r\n
    private BulkString readBulkString(ByteBuf in) {
        long length = readLength(in);
        if (length == -1) {
            return new BulkString((byte[]) null);
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new IllegalStateException("Invalid bulk length: " + length);
        }

        // readSlice 在字节不足时触发回放，不会提前分配
        ByteBuf payload = in.readSlice((int) length);
        expectCrlf(in);
        return new BulkString(ByteBufUtil.getBytes(payload));
    }

    // *<count>\r\n<element1>...<elementN>
    private RedisArray readArray(ByteBuf in) {
        long count = readLength(in);
        if (count == -1) {
            return new RedisArray(null);
        }
        if (count < 0 || count > MAX_ARRAY_LENGTH) {
            throw new IllegalStateException("Invalid multibulk length: " + count);
        }

        List<RedisMessage> elements = new ArrayList<>((int) Math.min(count, INITIAL_ARRAY_CAPACITY));
        for (long i = 0; i < count; i++) {
            elements.add(readMessage(in));
        }
        return RedisArray.of(elements);
    }

    // 一行以 CRLF 结尾；还没读到 LF 时 bytesBefore 会触发回放
    private String readLine(ByteBuf in) {
        int lf = in.bytesBefore(LF);
        if (lf < 1 || in.getByte(in.readerIndex() + lf - 1) != CR) {
            throw new IllegalStateException("Expected CRLF");
        }
        String line = in.readSlice(lf - 1).toString(StandardCharsets.UTF_8);
        in.skipBytes(2);
        return line;
    }

    private long readLength(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer in RESP frame: '" + s + "'", e);
        }
    }

    private void expectCrlf(ByteBuf in) {
        if (in.readByte() != CR || in.readByte() != LF) {
            throw new IllegalStateException("Expected CRLF");
        }
    }
}

package org.muma.kvlite.rdb;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * RDB 基础读取器
 * 负责长度编码、字符串 (含整数特殊编码) 以及小端整数的读取，不关心 opcode 语义。
 */
public class RdbDecoder {

    private final DataInputStream in;

    public RdbDecoder(InputStream in) {
        // 使用 DataInputStream 方便读取 byte, int, long (读到一半遇到流结束会抛 EOFException)
        this.in = new DataInputStream(in);
    }

    /**
     * 读取一个字节 (0-255)
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    /**
     * 读取下一个 opcode，流正好在记录边界结束时返回 -1
     */
    public int readOpcode() throws IOException {
        return in.read();
    }

    /**
     * 读取指定长度的字节数组
     */
    public byte[] readBytes(int len) throws IOException {
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * 读取 RDB 长度编码
     * <ul>
     *     <li>00xxxxxx: 6 位长度</li>
     *     <li>01xxxxxx xxxxxxxx: 14 位长度</li>
     *     <li>10xxxxxx + 4 bytes: 32 位长度 (little endian)</li>
     *     <li>11xxxxxx: 特殊编码，这里不允许出现</li>
     * </ul>
     *
     * @return 解析出的长度值
     */
    public long readLength() throws IOException {
        int b = readByte();
        int type = (b & 0xC0) >> 6;
        if (type == RdbConstants.LEN_ENCVAL) {
            throw new RdbFormatException("Expected a plain length but found special encoding " + (b & 0x3F));
        }
        return readLength(b, type);
    }

    private long readLength(int b, int type) throws IOException {
        if (type == RdbConstants.LEN_6BIT) {
            return b & 0x3F;
        } else if (type == RdbConstants.LEN_14BIT) {
            int next = readByte();
            return ((long) (b & 0x3F) << 8) | next;
        } else {
            // 忽略 b 的低 6 位，直接读后续 4 字节
            return readUnsignedIntLE();
        }
    }

    // --- 字符串 ---

    /**
     * 读取字符串对象。
     * 整数特殊编码会被还原成十进制文本，上层看到的永远是 "逻辑字符串"。
     */
    public byte[] readString() throws IOException {
        int b = readByte();
        int type = (b & 0xC0) >> 6;
        if (type == RdbConstants.LEN_ENCVAL) {
            return readEncodedString(b & 0x3F);
        }

        long len = readLength(b, type);
        if (len > Integer.MAX_VALUE) {
            throw new RdbFormatException("String too long: " + len);
        }
        return readBytes((int) len);
    }

    public String readStringUtf8() throws IOException {
        return new String(readString(), StandardCharsets.UTF_8);
    }

    private byte[] readEncodedString(int encoding) throws IOException {
        long value = switch (encoding) {
            case RdbConstants.ENC_INT8 -> in.readByte();
            case RdbConstants.ENC_INT16 -> Short.reverseBytes(in.readShort());
            case RdbConstants.ENC_INT32 -> readIntLE();
            case RdbConstants.ENC_COMPRESSED ->
                    throw new RdbFormatException("Compressed strings are not supported");
            default -> throw new RdbFormatException("Unknown string encoding: " + encoding);
        };
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    // --- 小端整数 ---

    public int readIntLE() throws IOException {
        return Integer.reverseBytes(in.readInt());
    }

    public long readUnsignedIntLE() throws IOException {
        return Integer.toUnsignedLong(readIntLE());
    }

    public long readLongLE() throws IOException {
        return Long.reverseBytes(in.readLong());
    }
}

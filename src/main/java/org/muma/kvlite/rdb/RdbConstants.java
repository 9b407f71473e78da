package org.muma.kvlite.rdb;

import java.nio.charset.StandardCharsets;

public class RdbConstants {

    // Header: REDIS0011
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.US_ASCII);
    public static final int VERSION_LENGTH = 4;

    // --- OpCodes (操作码) ---

    // 辅助字段 (Auxiliary field)，例如 redis-ver / ctime
    public static final int OP_AUX = 0xFA; // 250

    // 哈希表大小提示 (Resize DB)
    public static final int OP_RESIZEDB = 0xFB; // 251

    // 过期时间 (毫秒, 8 bytes, little endian)
    public static final int OP_EXPIRETIME_MS = 0xFC; // 252

    // 过期时间 (秒, 4 bytes, little endian, 旧版本格式)
    public static final int OP_EXPIRETIME = 0xFD; // 253

    // 数据库选择 (SELECT DB)
    public static final int OP_SELECTDB = 0xFE; // 254

    // RDB 文件结束
    public static final int OP_EOF = 0xFF; // 255

    // --- Length Encoding (首字节高 2 位) ---
    public static final int LEN_6BIT = 0;
    public static final int LEN_14BIT = 1;
    public static final int LEN_32BIT = 2;
    public static final int LEN_ENCVAL = 3;

    // --- 特殊字符串编码 (LEN_ENCVAL 时低 6 位) ---
    public static final int ENC_INT8 = 0;
    public static final int ENC_INT16 = 1;
    public static final int ENC_INT32 = 2;
    public static final int ENC_COMPRESSED = 3;

    private RdbConstants() {
    }
}

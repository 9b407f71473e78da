package org.muma.kvlite.rdb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RDB 文件解析
 * 输入字节流，输出 key -> {@link SnapshotRecord}，不涉及存储和网络。
 */
public class RdbParser {

    private static final Logger log = LoggerFactory.getLogger(RdbParser.class);

    public RdbSnapshot parse(InputStream input) throws IOException {
        RdbDecoder decoder = new RdbDecoder(input);

        // 1. Check Magic "REDIS" (大小写不敏感)
        byte[] magic = decoder.readBytes(RdbConstants.MAGIC.length);
        String magicText = new String(magic, StandardCharsets.US_ASCII);
        if (!magicText.equalsIgnoreCase(new String(RdbConstants.MAGIC, StandardCharsets.US_ASCII))) {
            throw new RdbFormatException("Invalid RDB file: bad magic '" + magicText + "'");
        }

        // 2. Read Version (4 bytes ASCII)，只记录不校验
        int version = parseVersion(decoder.readBytes(RdbConstants.VERSION_LENGTH));
        log.debug("Parsing RDB file, version {}", version);

        // 3. Loop Opcodes
        Map<String, SnapshotRecord> records = new LinkedHashMap<>();
        boolean hasPendingExpiry = false;
        long pendingExpireAt = 0;

        while (true) {
            int type = decoder.readOpcode();

            if (type == -1) {
                log.warn("RDB stream ended without EOF opcode");
                break;
            } else if (type == RdbConstants.OP_EOF) {
                break;
            } else if (type == RdbConstants.OP_AUX) {
                String auxKey = decoder.readStringUtf8();
                String auxValue = decoder.readStringUtf8();
                log.debug("RDB aux field {}={}", auxKey, auxValue);
                continue;
            } else if (type == RdbConstants.OP_RESIZEDB) {
                long dbSize = decoder.readLength();
                long expiresSize = decoder.readLength();
                log.debug("RDB resizedb hint: db={}, expires={}", dbSize, expiresSize);
                continue;
            } else if (type == RdbConstants.OP_SELECTDB) {
                long dbIndex = decoder.readLength(); // 单库模型，忽略
                log.debug("RDB selectdb {}", dbIndex);
                continue;
            } else if (type == RdbConstants.OP_EXPIRETIME_MS) {
                pendingExpireAt = decoder.readLongLE();
                hasPendingExpiry = true;
                continue; // 下一个字节是 value type
            } else if (type == RdbConstants.OP_EXPIRETIME) {
                // 秒级时间戳转毫秒
                pendingExpireAt = decoder.readUnsignedIntLE() * 1000L;
                hasPendingExpiry = true;
                continue;
            }

            // --- 读 Key-Value ---
            // 此时 type 是 value type
            String key = decoder.readStringUtf8();
            byte[] value = readValue(decoder, type, key);

            SnapshotRecord record = hasPendingExpiry
                    ? SnapshotRecord.expiring(key, value, pendingExpireAt)
                    : SnapshotRecord.persistent(key, value);
            hasPendingExpiry = false;

            records.put(key, record);
        }

        return new RdbSnapshot(version, records);
    }

    private byte[] readValue(RdbDecoder decoder, int type, String key) throws IOException {
        if (type == RdbType.STRING) {
            return decoder.readString();
        }
        throw new RdbFormatException("Unsupported value type " + type + " for key '" + key + "'");
    }

    private int parseVersion(byte[] raw) {
        String text = new String(raw, StandardCharsets.US_ASCII);
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                log.warn("RDB version is not numeric: '{}'", text);
                return -1;
            }
        }
        return Integer.parseInt(text);
    }
}

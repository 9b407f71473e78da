package org.muma.kvlite.rdb;

import java.util.Map;

/**
 * @param version 文件头中的版本号，不是数字时为 -1
 */
public record RdbSnapshot(int version, Map<String, SnapshotRecord> records) {
}

package org.muma.kvlite.rdb;

import java.util.Collections;
import java.util.Map;

/**
 * 启动时 RDB 加载的结果。加载失败不会阻止启动，store 以空数据启动。
 *
 * @param error 只有 FAILED 时非空
 */
public record SnapshotLoadResult(Status status, Map<String, SnapshotRecord> records, String detail, Exception error) {

    public enum Status {
        LOADED, SKIPPED, FAILED
    }

    public static SnapshotLoadResult loaded(RdbSnapshot snapshot, String detail) {
        return new SnapshotLoadResult(Status.LOADED, snapshot.records(), detail, null);
    }

    public static SnapshotLoadResult skipped(String detail) {
        return new SnapshotLoadResult(Status.SKIPPED, Collections.emptyMap(), detail, null);
    }

    public static SnapshotLoadResult failed(String detail, Exception error) {
        return new SnapshotLoadResult(Status.FAILED, Collections.emptyMap(), detail, error);
    }
}

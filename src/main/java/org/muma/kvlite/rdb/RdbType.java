package org.muma.kvlite.rdb;

public class RdbType {

    // 目前只支持字符串类型的 value，其余类型 (LIST=1, SET=2, ZSET=3, HASH=4 ...) 在解析时直接报错
    public static final int STRING = 0;

    private RdbType() {
    }
}

package org.muma.kvlite.rdb;

import java.io.IOException;

/**
 * RDB 文件内容不合法或包含不支持的编码
 */
public class RdbFormatException extends IOException {

    public RdbFormatException(String message) {
        super(message);
    }
}

package org.muma.kvlite.protocol;

import java.util.List;

// 5. 数组 (*) - elements 为 null 时表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static RedisArray of(List<? extends RedisMessage> elements) {
        return new RedisArray(elements.toArray(new RedisMessage[0]));
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }
}

package org.muma.minikv.protocol;

import java.util.Objects;

// 1. 简单字符串 (+) - 单行，不能包含 CR/LF
public record SimpleString(String content) implements RedisMessage {

    public SimpleString {
        Objects.requireNonNull(content, "content");
        if (!isSingleLine(content)) {
            throw new IllegalArgumentException("Simple string must not contain CR or LF");
        }
    }

    static boolean isSingleLine(String s) {
        return s.indexOf('\r') < 0 && s.indexOf('\n') < 0;
    }
}

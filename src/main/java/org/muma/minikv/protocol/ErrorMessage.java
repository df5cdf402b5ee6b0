package org.muma.minikv.protocol;

import java.util.Objects;

// 2. 错误 (-) - 单行，不能包含 CR/LF
public record ErrorMessage(String content) implements RedisMessage {

    public ErrorMessage {
        Objects.requireNonNull(content, "content");
        if (!SimpleString.isSingleLine(content)) {
            throw new IllegalArgumentException("Error message must not contain CR or LF");
        }
    }

    /**
     * 错误信息里拼接了客户端输入时使用，CR/LF 替换为空格
     */
    public static ErrorMessage sanitized(String content) {
        return new ErrorMessage(content.replace('\r', ' ').replace('\n', ' '));
    }
}

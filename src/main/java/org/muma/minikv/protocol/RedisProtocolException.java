package org.muma.minikv.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * 线路上出现非法 RESP 数据
 * 只影响当前连接：由 Handler 回复错误后关闭 Channel
 */
public class RedisProtocolException extends DecoderException {

    public RedisProtocolException(String message) {
        super(message);
    }

    public RedisProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.muma.minikv.utils;

import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisInteger;
import org.muma.minikv.protocol.RedisMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RespCodecUtilTest {

    @Test
    void testEncodeCommandLengths() {
        // 复制偏移量依赖这些确定的字节数
        assertEquals(27, RespCodecUtil.encodeCommand(RedisArray.of("SET", "x", "1").elements()).length);
        assertEquals(27, RespCodecUtil.encodeCommand(RedisArray.of("SET", "y", "2").elements()).length);
        assertEquals(20, RespCodecUtil.encodeCommand(RedisArray.of("DEL", "x").elements()).length);
        assertEquals(14, RespCodecUtil.encodeCommand(RedisArray.of("PING").elements()).length);
    }

    @Test
    void testEncodeCommandIsCanonical() {
        byte[] bytes = RespCodecUtil.encodeCommand(RedisArray.of("set", "key", "value with space").elements());
        assertEquals("*3\r\n$3\r\nset\r\n$3\r\nkey\r\n$16\r\nvalue with space\r\n",
                new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void testEncodeCommandRejectsNonBulkArguments() {
        RedisMessage[] args = {new BulkString("SET"), new RedisInteger(1)};
        assertThrows(IllegalArgumentException.class, () -> RespCodecUtil.encodeCommand(args));
    }
}

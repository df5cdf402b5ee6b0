package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RespEncoderTest {

    private static String encode(RedisMessage msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        channel.writeOutbound(msg);
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Test
    void testEncodeScalars() {
        assertEquals("+OK\r\n", encode(new SimpleString("OK")));
        assertEquals("-ERR syntax error\r\n", encode(new ErrorMessage("ERR syntax error")));
        assertEquals(":1000\r\n", encode(new RedisInteger(1000)));
        assertEquals("$5\r\nhello\r\n", encode(new BulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
    }

    @Test
    void testEncodeNulls() {
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("*-1\r\n", encode(new RedisArray(null)));
        assertEquals("*0\r\n", encode(RedisArray.EMPTY));
    }

    @Test
    void testEncodeArray() {
        assertEquals("*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n", encode(RedisArray.of("ECHO", "hi")));
    }

    @Test
    void testRdbPayloadHasNoTrailingCrlf() {
        assertEquals("$5\r\nREDIS", encode(new RdbPayload("REDIS".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testRawBytesPassThrough() {
        // 命令传播直接写 ByteBuf，不经过编码
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        byte[] raw = "*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.UTF_8);
        channel.writeOutbound(Unpooled.wrappedBuffer(raw));
        ByteBuf out = channel.readOutbound();
        byte[] bytes = new byte[out.readableBytes()];
        out.readBytes(bytes);
        out.release();
        assertArrayEquals(raw, bytes);
    }
}

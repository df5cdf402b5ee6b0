package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.minikv.utils.RespCodecUtil;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new RespDecoder());
    }

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeCommandArray() {
        channel.writeInbound(buf("*2\r\n$3\r\nGET\r\n$3\r\nkey\r\n"));
        RedisMessage msg = channel.readInbound();
        assertEquals(RedisArray.of("GET", "key"), msg);
        assertNull(channel.readInbound());
    }

    @Test
    void testDecodeSplitAcrossReads() {
        // 半包：第一批字节不足一个完整帧
        channel.writeInbound(buf("*3\r\n$3\r\nSET\r\n$1\r\nk"));
        assertNull(channel.readInbound());

        channel.writeInbound(buf("\r\n$5\r\nhello\r\n"));
        assertEquals(RedisArray.of("SET", "k", "hello"), channel.readInbound());
    }

    @Test
    void testDecodeMultipleFramesInOneRead() {
        // 粘包：一次读到多个帧
        channel.writeInbound(buf("+OK\r\n:42\r\n-ERR boom\r\n"));
        assertEquals(new SimpleString("OK"), channel.readInbound());
        assertEquals(new RedisInteger(42), channel.readInbound());
        assertEquals(new ErrorMessage("ERR boom"), channel.readInbound());
    }

    @Test
    void testDecodeNulls() {
        channel.writeInbound(buf("$-1\r\n*-1\r\n"));
        RedisMessage nullBulk = channel.readInbound();
        RedisMessage nullArray = channel.readInbound();
        assertTrue(((BulkString) nullBulk).isNull());
        assertTrue(((RedisArray) nullArray).isNull());
    }

    @Test
    void testBulkStringIsBinarySafe() {
        byte[] payload = {'a', '\r', '\n', 0, (byte) 0xFF};
        ByteBuf in = Unpooled.buffer();
        in.writeBytes("$5\r\n".getBytes(StandardCharsets.UTF_8));
        in.writeBytes(payload);
        in.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));

        channel.writeInbound(in);
        BulkString bulk = channel.readInbound();
        assertArrayEquals(payload, bulk.content());
    }

    @Test
    void testRoundTrip() {
        RedisMessage[] frames = {
                new SimpleString("PONG"),
                new ErrorMessage("ERR unknown command 'FOO'"),
                new RedisInteger(-7),
                new BulkString(""),
                BulkString.NULL,
                RedisArray.EMPTY,
                new RedisArray(null),
                new RedisArray(new RedisMessage[]{
                        new BulkString("nested"),
                        new RedisArray(new RedisMessage[]{new RedisInteger(1), BulkString.NULL}),
                        new SimpleString("中文")
                })
        };

        for (RedisMessage frame : frames) {
            channel.writeInbound(Unpooled.wrappedBuffer(RespCodecUtil.encode(frame)));
            assertEquals(frame, channel.readInbound(), "round trip of " + frame);
        }
    }

    @Test
    void testUnknownTypeByteIsProtocolError() {
        RedisProtocolException e = assertThrows(RedisProtocolException.class,
                () -> channel.writeInbound(buf("?hello\r\n")));
        assertTrue(e.getMessage().contains("unknown type byte"));
    }

    @Test
    void testNonNumericLengthIsProtocolError() {
        assertThrows(RedisProtocolException.class, () -> channel.writeInbound(buf("$abc\r\n")));
    }

    @Test
    void testNegativeLengthIsProtocolError() {
        assertThrows(RedisProtocolException.class, () -> channel.writeInbound(buf("*-2\r\n")));
    }

    @Test
    void testOversizedLengthIsProtocolError() {
        assertThrows(RedisProtocolException.class,
                () -> channel.writeInbound(buf("$" + (RespDecoder.MAX_BULK_LENGTH + 1L) + "\r\n")));
        EmbeddedChannel other = new EmbeddedChannel(new RespDecoder());
        assertThrows(RedisProtocolException.class,
                () -> other.writeInbound(buf("*" + (RespDecoder.MAX_ARRAY_LENGTH + 1) + "\r\n")));
    }

    @Test
    void testMissingTrailingCrlfIsProtocolError() {
        assertThrows(RedisProtocolException.class, () -> channel.writeInbound(buf("$3\r\nfooXY")));
    }

    @Test
    void testBareCrOrLfInLineIsProtocolError() {
        assertThrows(RedisProtocolException.class, () -> channel.writeInbound(buf("+a\rb\r\n")));
        EmbeddedChannel other = new EmbeddedChannel(new RespDecoder());
        assertThrows(RedisProtocolException.class, () -> other.writeInbound(buf("-a\nb\r\n")));
    }

    @Test
    void testFramesThatCannotRoundTripCannotBeBuilt() {
        // 单行类型中的 CR/LF 会破坏分帧
        assertThrows(IllegalArgumentException.class, () -> new SimpleString("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> new SimpleString("a\nb"));
        assertThrows(IllegalArgumentException.class, () -> new ErrorMessage("ERR a\rb"));
        // null 元素应使用 BulkString.NULL
        assertThrows(IllegalArgumentException.class, () -> new RedisArray(new RedisMessage[]{null}));

        // 拼接了客户端输入的错误信息仍可编码并原样解码
        ErrorMessage err = ErrorMessage.sanitized("ERR unknown command 'a\r\nb'");
        assertEquals("ERR unknown command 'a  b'", err.content());
        RedisArray nested = new RedisArray(new RedisMessage[]{
                new SimpleString("OK"), err, BulkString.NULL, new RedisArray(null), new BulkString("a\r\nb")});
        channel.writeInbound(Unpooled.wrappedBuffer(RespCodecUtil.encode(nested)));
        assertEquals(nested, channel.readInbound());
    }

    @Test
    void testFramesDoNotShareCallerArrays() {
        byte[] raw = "abc".getBytes(StandardCharsets.UTF_8);
        BulkString bulk = new BulkString(raw);
        raw[0] = 'x';
        assertEquals("abc", bulk.asString());

        RedisMessage[] elements = {new BulkString("a")};
        RedisArray array = new RedisArray(elements);
        elements[0] = new BulkString("b");
        assertEquals(RedisArray.of("a"), array);
    }

    @Test
    void testMasterLinkModeReportsFrameLengths() {
        EmbeddedChannel link = new EmbeddedChannel(new RespDecoder(true));
        byte[] rdb = {'R', 'E', 'D', 'I', 'S', 1, 2, 3};

        ByteBuf in = Unpooled.buffer();
        in.writeBytes("+FULLRESYNC 0123456789abcdef0123456789abcdef01234567 0\r\n".getBytes(StandardCharsets.UTF_8));
        in.writeBytes(("$" + rdb.length + "\r\n").getBytes(StandardCharsets.UTF_8));
        in.writeBytes(rdb);
        // 快照后面紧跟命令流，没有 CRLF 分隔
        in.writeBytes("*3\r\n$3\r\nSET\r\n$1\r\nx\r\n$1\r\n1\r\n".getBytes(StandardCharsets.UTF_8));
        link.writeInbound(in);

        RespFrame header = link.readInbound();
        assertInstanceOf(SimpleString.class, header.message());
        assertEquals(56, header.length());

        RespFrame snapshot = link.readInbound();
        RdbPayload payload = assertInstanceOf(RdbPayload.class, snapshot.message());
        assertArrayEquals(rdb, payload.content());
        assertEquals(4 + rdb.length, snapshot.length());

        RespFrame command = link.readInbound();
        assertEquals(RedisArray.of("SET", "x", "1"), command.message());
        assertEquals(27, command.length());
    }
}

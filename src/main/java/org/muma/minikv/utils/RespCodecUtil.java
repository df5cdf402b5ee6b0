package org.muma.minikv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.muma.minikv.protocol.BulkString;
import org.muma.minikv.protocol.ErrorMessage;
import org.muma.minikv.protocol.RdbPayload;
import org.muma.minikv.protocol.RedisArray;
import org.muma.minikv.protocol.RedisInteger;
import org.muma.minikv.protocol.RedisMessage;
import org.muma.minikv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议编码工具类
 * RespEncoder 与命令传播 (Master -> Slave) 共用同一套编码逻辑，保证字节数确定，方便计算复制偏移量
 */
public class RespCodecUtil {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    private RespCodecUtil() {
    }

    /**
     * 编码为独立的字节数组
     */
    public static byte[] encode(RedisMessage msg) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            write(buf, msg);
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    /**
     * 递归写入，数组元素可以是任意类型
     */
    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeBytes(s.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeBytes(e.content().getBytes(StandardCharsets.UTF_8));
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, a.elements().length);
                for (RedisMessage element : a.elements()) {
                    write(out, element);
                }
            }
        } else if (msg instanceof RdbPayload rdb) {
            // $<len>\r\n<bytes>，没有结尾 CRLF
            out.writeByte('$');
            writeNumber(out, rdb.content().length);
            out.writeBytes(rdb.content());
        } else {
            throw new IllegalArgumentException("Cannot encode " + (msg == null ? "null" : msg.getClass().getSimpleName()));
        }
    }

    /**
     * 把命令参数重新编码为 BulkString 数组 (传播格式)
     * 无论客户端原始请求如何分帧，传播出去的字节都是同一种规范形式
     */
    public static byte[] encodeCommand(RedisMessage[] args) {
        RedisMessage[] normalized = new RedisMessage[args.length];
        for (int i = 0; i < args.length; i++) {
            if (args[i] instanceof BulkString bs) {
                normalized[i] = bs;
            } else {
                // 理论上命令参数都是 BulkString，Handler 已经校验过
                throw new IllegalArgumentException("Unsupported type in command: " + args[i].getClass().getSimpleName());
            }
        }
        return encode(new RedisArray(normalized));
    }

    private static void writeNumber(ByteBuf out, long value) {
        out.writeBytes(String.valueOf(value).getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }
}

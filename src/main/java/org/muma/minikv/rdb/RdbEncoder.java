package org.muma.minikv.rdb;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * RDB 序列化器
 * 负责将 Java 对象转换为 RDB 格式的字节流。
 * 遵循 Redis RDB 版本 9 协议规范 (简化版)。
 */
public class RdbEncoder {

    private final OutputStream out;

    public RdbEncoder(OutputStream out) {
        this.out = out;
    }

    /**
     * 写入一个字节
     */
    public void writeByte(int b) throws IOException {
        out.write(b);
    }

    /**
     * 写入字节数组 (原样写入，不带长度)
     */
    public void writeBytes(byte[] bytes) throws IOException {
        out.write(bytes);
    }

    /**
     * 写入 RDB 长度编码 (Length Encoding)
     * <p>
     * 规则:
     * - 00xxxxxx: len < 64 (1 byte)
     * - 01xxxxxx: len < 16384 (2 bytes)
     * - 10000000: len <= 0xFFFFFFFF (5 bytes, 1 byte flag + 4 bytes len, Big Endian)
     * - 10000001: 其余 (9 bytes, 1 byte flag + 8 bytes len, Big Endian)
     */
    public void writeLength(long len) throws IOException {
        if (len < 64) {
            out.write((int) (len & 0xFF));
        } else if (len < 16384) {
            // 高 2 位是 01，剩下 14 位存长度
            out.write(0x40 | (int) ((len >> 8) & 0x3F));
            out.write((int) (len & 0xFF));
        } else if (len <= 0xFFFFFFFFL) {
            out.write(RdbConstants.LEN_32BIT);
            writeIntBE((int) len);
        } else {
            out.write(RdbConstants.LEN_64BIT);
            writeIntBE((int) (len >>> 32));
            writeIntBE((int) len);
        }
    }

    private void writeIntBE(int v) throws IOException {
        out.write((v >>> 24) & 0xFF);
        out.write((v >>> 16) & 0xFF);
        out.write((v >>> 8) & 0xFF);
        out.write(v & 0xFF);
    }

    /**
     * 写入 8 字节长整数 (Little Endian)，Redis 的毫秒过期时间就是这样存的
     */
    public void writeLongLE(long v) throws IOException {
        for (int i = 0; i < 8; i++) {
            out.write((int) (v >>> (8 * i)) & 0xFF);
        }
    }

    /**
     * 写入字符串对象 (String Encoding)
     * 格式: [Length][Content]
     */
    public void writeString(byte[] bytes) throws IOException {
        writeLength(bytes.length);
        writeBytes(bytes);
    }

    public void writeString(String str) throws IOException {
        writeString(str.getBytes(StandardCharsets.UTF_8));
    }
}

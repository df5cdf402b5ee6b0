package org.muma.minikv.rdb;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * RDB 反序列化器
 * 负责从 InputStream 解析 RDB 格式数据。
 */
public class RdbDecoder {

    private final DataInputStream in;

    public RdbDecoder(InputStream in) {
        // 使用 DataInputStream 方便读取 byte, int, long
        this.in = new DataInputStream(in);
    }

    /**
     * 读取一个字节 (0-255)
     */
    public int readByte() throws IOException {
        return in.readUnsignedByte();
    }

    /**
     * 读取指定长度的字节数组
     */
    public byte[] readBytes(int len) throws IOException {
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }

    /**
     * 读取 RDB 长度编码
     *
     * @return 解析出的长度值
     */
    public long readLength() throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;
        if (type == RdbConstants.LEN_ENCVAL) {
            throw new IOException("Unexpected encoded value where a length was expected: 0x" + Integer.toHexString(b));
        }
        return readLengthBody(b, type);
    }

    private long readLengthBody(int b, int type) throws IOException {
        if (type == RdbConstants.LEN_6BIT) {
            // 00xxxxxx: 6位长度
            return b & 0x3F;
        } else if (type == RdbConstants.LEN_14BIT) {
            // 01xxxxxx xxxxxxxx: 14位长度
            int next = in.readUnsignedByte();
            return ((long) (b & 0x3F) << 8) | next;
        } else if (b == RdbConstants.LEN_32BIT) {
            return in.readInt() & 0xFFFFFFFFL; // 转为无符号 long
        } else if (b == RdbConstants.LEN_64BIT) {
            return in.readLong();
        }
        throw new IOException("Unknown RDB length encoding: 0x" + Integer.toHexString(b));
    }

    /**
     * 读取字符串对象
     * 支持普通长度前缀字符串，以及 Redis 对整数值的特殊编码 (INT8/16/32)
     */
    public byte[] readString() throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;
        if (type == RdbConstants.LEN_ENCVAL) {
            int encoding = b & 0x3F;
            long value = switch (encoding) {
                case RdbConstants.ENC_INT8 -> in.readByte();
                case RdbConstants.ENC_INT16 -> Short.reverseBytes(in.readShort());
                case RdbConstants.ENC_INT32 -> Integer.reverseBytes(in.readInt());
                case RdbConstants.ENC_LZF -> throw new IOException("LZF compressed strings are not supported");
                default -> throw new IOException("Unknown RDB string encoding: " + encoding);
            };
            return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
        }

        long len = readLengthBody(b, type);
        if (len > Integer.MAX_VALUE) {
            throw new IOException("String too long: " + len);
        }
        return readBytes((int) len);
    }

    public String readStringUtf8() throws IOException {
        return new String(readString(), StandardCharsets.UTF_8);
    }

    public long readLongLE() throws IOException {
        return Long.reverseBytes(in.readLong());
    }

    public int readIntLE() throws IOException {
        return Integer.reverseBytes(in.readInt());
    }
}

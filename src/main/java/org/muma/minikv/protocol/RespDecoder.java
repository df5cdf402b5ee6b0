package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RESP 协议解码器
 * 状态机逻辑由 ReplayingDecoder 自动处理：数据不够时回滚到帧起点，等下一批字节到达后重新解析
 * <p>
 * 两种工作模式：
 * <ul>
 *     <li>普通客户端连接：输出 {@link RedisMessage}</li>
 *     <li>Slave 侧的 Master 链路 (masterLink = true)：输出 {@link RespFrame}，附带该帧的字节数；
 *     并且在读到 +FULLRESYNC 之后，把紧跟着的 $ 帧按 RDB 快照 (无尾部 CRLF) 解析</li>
 * </ul>
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    // RESP 协议常量
    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 上限 (与 Redis 默认的 proto-max-bulk-len 等保持一致)
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final String FULLRESYNC = "FULLRESYNC";

    private final boolean masterLink;

    // 下一个 $ 帧是 RDB 快照
    private boolean expectSnapshot;

    public RespDecoder() {
        this(false);
    }

    public RespDecoder(boolean masterLink) {
        this.masterLink = masterLink;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int start = in.readerIndex();

        RedisMessage msg;
        if (expectSnapshot) {
            msg = decodeSnapshot(in);
            expectSnapshot = false;
        } else {
            msg = readNextObject(in);
        }

        if (!masterLink) {
            out.add(msg);
            return;
        }

        if (msg instanceof SimpleString ss && ss.content().startsWith(FULLRESYNC)) {
            expectSnapshot = true;
        }
        out.add(new RespFrame(msg, in.readerIndex() - start));
    }

    // 递归读取下一个完整的 RedisMessage
    // 在 ReplayingDecoder 中，如果数据不够，这里会抛出 Signal 异常并回滚索引
    private RedisMessage readNextObject(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new RedisProtocolException("unknown type byte '" + printable(type) + "'");
        };
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        int length = readLength(in, MAX_BULK_LENGTH, "bulk");
        if (length == -1) {
            return BulkString.NULL;
        }

        // readSlice 在数据不足时先触发回放，避免提前分配大数组
        byte[] content = ByteBufUtil.getBytes(in.readSlice(length));

        // 读取末尾的 CRLF
        readCRLF(in);

        return new BulkString(content);
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        int count = readLength(in, MAX_ARRAY_LENGTH, "multibulk");
        if (count == -1) {
            return new RedisArray(null);
        }

        RedisMessage[] elements = new RedisMessage[count];
        for (int i = 0; i < count; i++) {
            elements[i] = readNextObject(in);
        }
        return new RedisArray(elements);
    }

    // 解析 RDB: $<length>\r\n<rdb bytes>
    private RdbPayload decodeSnapshot(ByteBuf in) {
        byte type = in.readByte();
        if (type != DOLLAR_BYTE) {
            throw new RedisProtocolException("expected '$' before RDB payload, got '" + printable(type) + "'");
        }
        int length = readLength(in, MAX_BULK_LENGTH, "RDB");
        if (length < 0) {
            throw new RedisProtocolException("invalid RDB length: " + length);
        }
        return new RdbPayload(ByteBufUtil.getBytes(in.readSlice(length)));
    }

    // 读取一行（读取到 \r\n 为止），行内不允许单独出现 \r 或 \n
    private String readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                if (in.readByte() != LF) {
                    throw new RedisProtocolException("expected LF after CR in line");
                }
                break;
            }
            if (b == LF) {
                throw new RedisProtocolException("bare LF in line");
            }
            sb.append((char) (b & 0xFF));
            if (sb.length() > MAX_LINE_LENGTH) {
                throw new RedisProtocolException("too big inline request");
            }
        }
        // 按 UTF-8 还原 (上面按字节追加的是 ISO-8859-1 语义)
        return new String(sb.toString().getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
    }

    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RedisProtocolException("invalid integer '" + s + "'", e);
        }
    }

    // 读取长度字段：-1 表示 null，其他负数或超过上限都是协议错误
    private int readLength(ByteBuf in, int max, String kind) {
        String s = readLine(in);
        long len;
        try {
            len = Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RedisProtocolException("invalid " + kind + " length '" + s + "'", e);
        }
        if (len < -1 || len > max) {
            throw new RedisProtocolException("invalid " + kind + " length " + len);
        }
        return (int) len;
    }

    // 跳过 CRLF
    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RedisProtocolException("expected CRLF after bulk payload");
        }
    }

    private static String printable(byte b) {
        return b >= 32 && b < 127 ? String.valueOf((char) b) : String.format("\\x%02x", b);
    }
}

package org.muma.minikv.rdb;

import java.nio.charset.StandardCharsets;

public class RdbConstants {

    // Header: REDIS0009
    public static final byte[] MAGIC = "REDIS".getBytes(StandardCharsets.UTF_8);
    public static final String VERSION = "0009";

    // --- OpCodes (操作码) ---

    // 标识辅助字段 (Auxiliary field)
    public static final int OP_AUX = 0xFA; // 250

    // 标识调整哈希表大小 (Resize DB)
    public static final int OP_RESIZEDB = 0xFB; // 251

    // 标识过期时间 (毫秒, 8 bytes, 小端序)
    public static final int OP_EXPIRETIME_MS = 0xFC; // 252

    // 标识过期时间 (秒, 4 bytes, 小端序, 旧版本用)
    public static final int OP_EXPIRETIME = 0xFD; // 253

    // 标识数据库选择 (SELECT DB)
    public static final int OP_SELECTDB = 0xFE; // 254

    // 标识 RDB 文件结束
    public static final int OP_EOF = 0xFF; // 255

    // --- Value Types ---
    // 只支持字符串，其余类型 (LIST=1, SET=2 ...) 加载时报错
    public static final int TYPE_STRING = 0;

    // --- 长度编码 ---
    public static final int LEN_6BIT = 0;
    public static final int LEN_14BIT = 1;
    public static final int LEN_32OR64 = 2;
    public static final int LEN_ENCVAL = 3;
    public static final int LEN_32BIT = 0x80;
    public static final int LEN_64BIT = 0x81;

    // --- 特殊字符串编码 (11xxxxxx 的低 6 位) ---
    public static final int ENC_INT8 = 0;
    public static final int ENC_INT16 = 1;
    public static final int ENC_INT32 = 2;
    public static final int ENC_LZF = 3;

    private RdbConstants() {
    }
}

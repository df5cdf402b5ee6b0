package org.muma.minikv.rdb;

import org.muma.minikv.common.RedisData;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RDB 加载器
 * 既用于启动时读取 dir/dbfilename，也用于 Slave 全量同步时解析 Master 发来的快照
 */
public class RdbLoader {

    private static final Logger log = LoggerFactory.getLogger(RdbLoader.class);

    /**
     * 文件不存在视为空库
     */
    public List<RdbEntry> load(File file) throws IOException {
        if (!file.exists()) {
            log.info("No RDB file at {}, starting with an empty dataset", file.getPath());
            return Collections.emptyList();
        }

        log.info("Loading RDB file: {}", file.getPath());
        try (BufferedInputStream bis = new BufferedInputStream(new FileInputStream(file))) {
            return read(bis);
        }
    }

    public List<RdbEntry> read(byte[] rdb) throws IOException {
        return read(new ByteArrayInputStream(rdb));
    }

    public List<RdbEntry> read(InputStream in) throws IOException {
        RdbDecoder decoder = new RdbDecoder(in);
        List<RdbEntry> entries = new ArrayList<>();

        // 1. Check Magic "REDIS"
        byte[] magic = decoder.readBytes(5);
        if (!Arrays.equals(magic, RdbConstants.MAGIC)) {
            throw new IOException("Invalid RDB file: Bad Magic");
        }

        // 2. Read Version (4 bytes)，只要是数字即可
        String version = new String(decoder.readBytes(4));
        if (!version.chars().allMatch(Character::isDigit)) {
            throw new IOException("Invalid RDB version: " + version);
        }

        // 3. Loop Opcodes
        long expireAt = RedisData.NO_EXPIRE; // 当前 Key 的过期时间
        while (true) {
            int type = decoder.readByte();

            if (type == RdbConstants.OP_EOF) {
                // 之后是 8 字节 checksum，这里不校验
                break;
            } else if (type == RdbConstants.OP_SELECTDB) {
                decoder.readLength(); // DB ID, ignore
            } else if (type == RdbConstants.OP_RESIZEDB) {
                decoder.readLength(); // hash table size
                decoder.readLength(); // expire hash table size
            } else if (type == RdbConstants.OP_AUX) {
                String auxKey = decoder.readStringUtf8();
                String auxValue = decoder.readStringUtf8();
                log.debug("RDB aux field {}={}", auxKey, auxValue);
            } else if (type == RdbConstants.OP_EXPIRETIME_MS) {
                expireAt = decoder.readLongLE();
            } else if (type == RdbConstants.OP_EXPIRETIME) {
                // 秒级时间戳转毫秒
                expireAt = (decoder.readIntLE() & 0xFFFFFFFFL) * 1000;
            } else if (type == RdbConstants.TYPE_STRING) {
                String key = decoder.readStringUtf8();
                byte[] value = decoder.readString();
                entries.add(new RdbEntry(key, value, expireAt));
                expireAt = RedisData.NO_EXPIRE; // 重置
            } else {
                throw new IOException("Unsupported RDB value type: " + type);
            }
        }
        return entries;
    }

    /**
     * 写入存储，加载时已过期的条目直接丢弃
     *
     * @return 实际写入的 key 数量
     */
    public static int apply(List<RdbEntry> entries, StorageEngine storage, long now) {
        int count = 0;
        for (RdbEntry entry : entries) {
            if (entry.isExpired(now)) continue;
            storage.set(entry.key(), entry.value(), entry.expireAt());
            count++;
        }
        return count;
    }
}

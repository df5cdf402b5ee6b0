package org.muma.minikv.rdb;

import org.muma.minikv.common.RedisData;
import org.muma.minikv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把当前存储序列化为 RDB
 * 必须在 RedisCoreExecutor 线程调用，保证快照与后续传播的命令之间没有缝隙
 */
public class RdbSaver {

    private static final Logger log = LoggerFactory.getLogger(RdbSaver.class);

    private static final String REDIS_VER = "7.2.0";

    public byte[] serialize(StorageEngine storage, long now) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(256);
        try {
            writeTo(bos, storage, now);
        } catch (IOException e) {
            // ByteArrayOutputStream 不会真的抛 IO 异常
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    public void writeTo(OutputStream out, StorageEngine storage, long now) throws IOException {
        long start = System.currentTimeMillis();

        // 先拍一份快照，RESIZEDB 需要提前知道数量
        Map<String, RedisData> snapshot = new LinkedHashMap<>();
        int expires = 0;
        for (String key : storage.keys(now)) {
            RedisData data = storage.get(key, now);
            if (data == null) continue;
            snapshot.put(key, data);
            if (data.hasExpire()) expires++;
        }

        RdbEncoder encoder = new RdbEncoder(out);

        // 1. Header: REDIS0009
        encoder.writeBytes(RdbConstants.MAGIC);
        encoder.writeBytes(RdbConstants.VERSION.getBytes(StandardCharsets.UTF_8));

        // 2. Aux fields
        encoder.writeByte(RdbConstants.OP_AUX);
        encoder.writeString("redis-ver");
        encoder.writeString(REDIS_VER);
        encoder.writeByte(RdbConstants.OP_AUX);
        encoder.writeString("redis-bits");
        encoder.writeString("64");

        // 3. Select DB 0 + Resize DB
        encoder.writeByte(RdbConstants.OP_SELECTDB);
        encoder.writeLength(0);
        encoder.writeByte(RdbConstants.OP_RESIZEDB);
        encoder.writeLength(snapshot.size());
        encoder.writeLength(expires);

        // 4. 遍历 Key-Value
        for (Map.Entry<String, RedisData> entry : snapshot.entrySet()) {
            RedisData data = entry.getValue();
            if (data.hasExpire()) {
                encoder.writeByte(RdbConstants.OP_EXPIRETIME_MS);
                encoder.writeLongLE(data.getExpireAt());
            }
            encoder.writeByte(RdbConstants.TYPE_STRING);
            encoder.writeString(entry.getKey());
            encoder.writeString(data.getValue());
        }

        // 5. EOF + Checksum (写 8 个 0，表示不校验)
        encoder.writeByte(RdbConstants.OP_EOF);
        encoder.writeLongLE(0);
        out.flush();

        log.debug("RDB serialized: {} keys in {} ms", snapshot.size(), System.currentTimeMillis() - start);
    }
}

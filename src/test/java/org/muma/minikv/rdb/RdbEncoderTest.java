package org.muma.minikv.rdb;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;

class RdbEncoderTest {

    private ByteArrayOutputStream bos;
    private RdbEncoder encoder;

    @BeforeEach
    void setUp() {
        bos = new ByteArrayOutputStream();
        encoder = new RdbEncoder(bos);
    }

    @Test
    void testWriteLength() throws IOException {
        // Case 1: < 64 (0x05)
        encoder.writeLength(5);
        assertArrayEquals(new byte[]{0x05}, bos.toByteArray());
        bos.reset();

        // Case 2: 100 -> 01xxxxxx -> 0x40 0x64
        encoder.writeLength(100);
        assertArrayEquals(new byte[]{0x40, 0x64}, bos.toByteArray());
        bos.reset();

        // Case 3: 20000 -> 0x80 + int(20000) Big Endian
        encoder.writeLength(20000);
        assertArrayEquals(new byte[]{(byte) 0x80, 0, 0, 0x4E, 0x20}, bos.toByteArray());
        bos.reset();

        // Case 4: > 32 位 -> 0x81 + long
        encoder.writeLength(0x1_0000_0000L);
        assertArrayEquals(new byte[]{(byte) 0x81, 0, 0, 0, 1, 0, 0, 0, 0}, bos.toByteArray());
    }

    @Test
    void testWriteString() throws IOException {
        encoder.writeString("foo");
        // len=3 (0x03), 'f', 'o', 'o'
        assertArrayEquals(new byte[]{0x03, 'f', 'o', 'o'}, bos.toByteArray());
    }

    @Test
    void testWriteLongLittleEndian() throws IOException {
        encoder.writeLongLE(0x0102030405060708L);
        assertArrayEquals(new byte[]{8, 7, 6, 5, 4, 3, 2, 1}, bos.toByteArray());
    }
}

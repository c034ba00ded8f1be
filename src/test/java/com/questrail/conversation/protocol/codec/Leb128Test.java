package com.questrail.conversation.protocol.codec;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Leb128Test
 * -----------------------------------------------------------------------------
 * Unit tests for {@link Leb128}.
 */
final class Leb128Test
{
    private static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void decodesConcatenatedValuesInOrder() throws Exception
    {
        ByteBuffer in = ByteBuffer.wrap(bytes(
                0x02, 0x7f, 0x80, 0x01, 0x81, 0x01, 0x82, 0x01, 0xb9, 0x64, 0xe5, 0x8e, 0x26));

        assertEquals(2, Leb128.read(in));
        assertEquals(127, Leb128.read(in));
        assertEquals(128, Leb128.read(in));
        assertEquals(129, Leb128.read(in));
        assertEquals(130, Leb128.read(in));
        assertEquals(12857, Leb128.read(in));
        assertEquals(624485, Leb128.read(in));
        assertFalse(in.hasRemaining());
    }

    @Test
    void encodesKnownValues()
    {
        assertArrayEquals(bytes(0x00), Leb128.encode(0));
        assertArrayEquals(bytes(0x7f), Leb128.encode(127));
        assertArrayEquals(bytes(0x80, 0x01), Leb128.encode(128));
        assertArrayEquals(bytes(0xe5, 0x8e, 0x26), Leb128.encode(624485));
    }

    @Test
    void encodesConcatenatedValuesToKnownBytes()
    {
        long[] values = {2, 127, 128, 129, 130, 12857, 624485};
        ByteBuffer out = ByteBuffer.allocate(values.length * Leb128.MAX_LENGTH);
        for (long value : values) {
            Leb128.write(out, value);
        }
        out.flip();
        byte[] written = new byte[out.remaining()];
        out.get(written);

        assertArrayEquals(bytes(
                0x02, 0x7f, 0x80, 0x01, 0x81, 0x01, 0x82, 0x01, 0xb9, 0x64, 0xe5, 0x8e, 0x26), written);
    }

    @Test
    void boundaryValuesDecodeToThemselves() throws Exception
    {
        List<Long> values = new ArrayList<>(List.of(0L, -1L, Long.MAX_VALUE, Long.MIN_VALUE));
        for (int k = 1; k <= 9; k++) {
            long boundary = 1L << (7 * k);
            values.add(boundary - 1);
            values.add(boundary);
        }

        for (long value : values) {
            byte[] encoded = Leb128.encode(value);
            ByteBuffer in = ByteBuffer.wrap(encoded);
            assertEquals(value, Leb128.read(in), "value " + Long.toUnsignedString(value));
            assertFalse(in.hasRemaining());
            assertEquals(encoded.length, Leb128.encodedLength(value));
        }
    }

    @Test
    void maxUnsignedValueUsesTenBytes() throws Exception
    {
        byte[] encoded = Leb128.encode(-1L);

        assertEquals(Leb128.MAX_LENGTH, encoded.length);
        assertEquals(0x01, encoded[9]);
        assertEquals(-1L, Leb128.read(ByteBuffer.wrap(encoded)));
    }

    @Test
    void encodedLengthMatchesEncoding()
    {
        assertEquals(1, Leb128.encodedLength(0));
        assertEquals(1, Leb128.encodedLength(127));
        assertEquals(2, Leb128.encodedLength(128));
        assertEquals(3, Leb128.encodedLength(624485));
        assertEquals(10, Leb128.encodedLength(Long.MIN_VALUE));
    }

    @Test
    void valueBeyondSixtyFourBitsOverflows()
    {
        // Tenth byte may only carry bit 63.
        ByteBuffer in = ByteBuffer.wrap(bytes(
                0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0xff, 0x02));

        Leb128Exception ex = assertThrows(Leb128Exception.class, () -> Leb128.read(in));
        assertEquals(Leb128Exception.Kind.OVERFLOW, ex.kind());
    }

    @Test
    void elevenByteEncodingOverflows()
    {
        ByteBuffer in = ByteBuffer.wrap(bytes(
                0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x00));

        Leb128Exception ex = assertThrows(Leb128Exception.class, () -> Leb128.read(in));
        assertEquals(Leb128Exception.Kind.OVERFLOW, ex.kind());
    }

    @Test
    void bufferEndingOnContinuationByteIsTruncated()
    {
        Leb128Exception ex = assertThrows(Leb128Exception.class,
                () -> Leb128.read(ByteBuffer.wrap(bytes(0x80, 0x80))));
        assertEquals(Leb128Exception.Kind.TRUNCATED, ex.kind());
    }

    @Test
    void emptyBufferIsTruncated()
    {
        Leb128Exception ex = assertThrows(Leb128Exception.class,
                () -> Leb128.read(ByteBuffer.allocate(0)));
        assertEquals(Leb128Exception.Kind.TRUNCATED, ex.kind());
    }
}

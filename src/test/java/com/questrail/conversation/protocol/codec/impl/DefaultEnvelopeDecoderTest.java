package com.questrail.conversation.protocol.codec.impl;

import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeFlag;
import com.questrail.conversation.protocol.envelope.EnvelopeParseException;
import com.questrail.conversation.protocol.envelope.MessageKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultEnvelopeDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultEnvelopeDecoder}.
 */
final class DefaultEnvelopeDecoderTest
{
    private final DefaultEnvelopeDecoder decoder = new DefaultEnvelopeDecoder();

    private static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    @Test
    void decodesLittleEndianHeaderAndPayload() throws Exception
    {
        byte[] wire = bytes(
                0x05, 0, 0, 0, 0, 0, 0, 0,     // cookie 5
                0x02, 0x00,                    // SEND_MESSAGE
                0x03, 0x00,                    // MUST_PROCESS | RESPONSE_REQUIRED
                0x02,                          // length 2
                0xAA, 0xBB);

        Envelope envelope = decoder.decode(wire);

        assertEquals(new Cookie(5), envelope.cookie());
        assertEquals(MessageKind.SEND_MESSAGE.code(), envelope.kind());
        assertEquals(Set.of(EnvelopeFlag.MUST_PROCESS, EnvelopeFlag.RESPONSE_REQUIRED), envelope.flags());
        assertArrayEquals(bytes(0xAA, 0xBB), envelope.payload());
    }

    @Test
    void serverCookieUsesHighBit() throws Exception
    {
        byte[] wire = bytes(0x01, 0, 0, 0, 0, 0, 0, 0x80, 0x00, 0x80, 0, 0, 0);

        Envelope envelope = decoder.decode(wire);

        assertTrue(envelope.cookie().isServer());
        assertEquals(1, envelope.cookie().sequence());
        assertEquals(MessageKind.UNKNOWN_EVENT, envelope.knownKind().orElseThrow());
    }

    @Test
    void shortHeaderIsUnderflow()
    {
        EnvelopeParseException ex = assertThrows(EnvelopeParseException.class,
                () -> decoder.decode(new byte[11]));

        assertEquals(EnvelopeParseException.Reason.UNDERFLOW, ex.reason());
        assertEquals(4000, ex.reason().closeCode());
    }

    @Test
    void missingLengthIsUnderflow()
    {
        EnvelopeParseException ex = assertThrows(EnvelopeParseException.class,
                () -> decoder.decode(new byte[12]));

        assertEquals(EnvelopeParseException.Reason.UNDERFLOW, ex.reason());
    }

    @Test
    void unknownFlagBitsAreRejectedBeforeLength()
    {
        // Flags 0x04 and no length byte: the flag check wins.
        byte[] wire = bytes(0, 0, 0, 0, 0, 0, 0, 0, 0x02, 0x00, 0x04, 0x00);

        EnvelopeParseException ex = assertThrows(EnvelopeParseException.class, () -> decoder.decode(wire));

        assertEquals(EnvelopeParseException.Reason.BAD_FLAGS, ex.reason());
        assertEquals(4004, ex.reason().closeCode());
    }

    @Test
    void declaredLengthMustMatchRemainder()
    {
        byte[] tooShort = bytes(0, 0, 0, 0, 0, 0, 0, 0, 0x02, 0x00, 0x00, 0x00, 0x03, 0x01);
        byte[] tooLong = bytes(0, 0, 0, 0, 0, 0, 0, 0, 0x02, 0x00, 0x00, 0x00, 0x00, 0x01);

        assertEquals(EnvelopeParseException.Reason.LENGTH_MISMATCH,
                assertThrows(EnvelopeParseException.class, () -> decoder.decode(tooShort)).reason());
        assertEquals(EnvelopeParseException.Reason.LENGTH_MISMATCH,
                assertThrows(EnvelopeParseException.class, () -> decoder.decode(tooLong)).reason());
    }

    @Test
    void overlongLengthVarintIsUnderflow()
    {
        byte[] wire = Arrays.copyOf(new byte[12], 23);
        Arrays.fill(wire, 12, 23, (byte) 0xFF);

        EnvelopeParseException ex = assertThrows(EnvelopeParseException.class, () -> decoder.decode(wire));

        assertEquals(EnvelopeParseException.Reason.UNDERFLOW, ex.reason());
    }

    @Test
    void decodesWhatEncoderWrites() throws Exception
    {
        Envelope original = new Envelope(new Cookie(Cookie.SERVER_BIT | 77), 0x1234,
                Set.of(EnvelopeFlag.MUST_PROCESS), new byte[300]);

        assertEquals(original, decoder.decode(new DefaultEnvelopeEncoder().encode(original)));
    }
}

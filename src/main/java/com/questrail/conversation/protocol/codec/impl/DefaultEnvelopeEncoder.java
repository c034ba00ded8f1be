package com.questrail.conversation.protocol.codec.impl;

import com.questrail.conversation.protocol.codec.EnvelopeEncoder;
import com.questrail.conversation.protocol.codec.Leb128;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeFlag;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Concrete implementation of {@link EnvelopeEncoder}.
 */
public final class DefaultEnvelopeEncoder implements EnvelopeEncoder
{
    @Override
    public byte[] encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        final byte[] payload = envelope.payload();
        final int size = EnvelopeLayout.FIXED_HEADER_LENGTH
                + Leb128.encodedLength(payload.length)
                + payload.length;

        final ByteBuffer out = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        out.putLong(envelope.cookie().value());
        out.putShort((short) envelope.kind());
        out.putShort((short) EnvelopeFlag.toBits(envelope.flags()));
        Leb128.write(out, payload.length);
        out.put(payload);

        return out.array();
    }
}

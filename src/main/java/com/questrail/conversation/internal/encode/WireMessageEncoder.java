package com.questrail.conversation.internal.encode;

import com.questrail.conversation.protocol.codec.Leb128;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeFlag;
import com.questrail.conversation.protocol.model.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * WireMessageEncoder
 * ============================================================================
 * Converts a semantic {@link WireMessage} into an {@link Envelope}.
 *
 * <h2>What this encoder does</h2>
 * <ul>
 *   <li>Selects the kind code for the message subtype</li>
 *   <li>Lays out the payload</li>
 *   <li>Applies the default flags of the kind</li>
 * </ul>
 *
 * <h2>Default flags</h2>
 * <ul>
 *   <li>{@link NewMessage}: {@code MUST_PROCESS}</li>
 *   <li>{@link SendMessage}: {@code MUST_PROCESS | RESPONSE_REQUIRED}</li>
 *   <li>everything else: none</li>
 * </ul>
 *
 * Header bytes and the payload length are written by an
 * {@link com.questrail.conversation.protocol.codec.EnvelopeEncoder}.
 */
public final class WireMessageEncoder
{
    /**
     * Encode a semantic {@link WireMessage} into an {@link Envelope}.
     */
    public Envelope encode(WireMessage message)
    {
        Objects.requireNonNull(message, "message");

        final Set<EnvelopeFlag> flags;
        final byte[] payload;

        if (message instanceof Connected || message instanceof UnknownEvent) {
            flags = Set.of();
            payload = new byte[0];
        }
        else if (message instanceof SendMessage send) {
            flags = EnumSet.of(EnvelopeFlag.MUST_PROCESS, EnvelopeFlag.RESPONSE_REQUIRED);
            payload = send.body();
        }
        else if (message instanceof MessageReceived received) {
            flags = Set.of();
            payload = Leb128.encode(received.id());
        }
        else if (message instanceof MessageInvalid invalid) {
            flags = Set.of();
            payload = invalid.diagnostic()
                    .map(text -> text.getBytes(StandardCharsets.UTF_8))
                    .orElseGet(() -> new byte[0]);
        }
        else if (message instanceof NewMessage newMessage) {
            flags = EnumSet.of(EnvelopeFlag.MUST_PROCESS);
            payload = encodeNewMessage(newMessage);
        }
        else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }

        return new Envelope(message.cookie(), message.kind(), flags, payload);
    }

    private static byte[] encodeNewMessage(NewMessage message)
    {
        final byte[] body = message.body();
        final ByteBuffer out = ByteBuffer.allocate(
                        Leb128.encodedLength(message.id())
                        + Leb128.encodedLength(message.user())
                        + Long.BYTES
                        + body.length)
                .order(ByteOrder.LITTLE_ENDIAN);

        Leb128.write(out, message.id());
        Leb128.write(out, message.user());
        out.putLong(message.timestamp().getEpochSecond());
        out.put(body);
        return out.array();
    }
}

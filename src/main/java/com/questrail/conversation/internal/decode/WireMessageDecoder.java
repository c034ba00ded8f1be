package com.questrail.conversation.internal.decode;

import com.questrail.conversation.protocol.codec.Leb128;
import com.questrail.conversation.protocol.codec.Leb128Exception;
import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.MessageKind;
import com.questrail.conversation.protocol.model.*;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * WireMessageDecoder
 * ============================================================================
 * Converts a structurally valid {@link Envelope} into a semantic
 * {@link WireMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between envelope mechanics (kind codes, payload
 * byte layout) and protocol semantics. Sessions and clients reason about
 * {@link WireMessage}s and never about payload offsets.
 *
 * <h2>What this decoder assumes</h2>
 * The envelope header has already been checked by an
 * {@link com.questrail.conversation.protocol.codec.EnvelopeDecoder}: the
 * payload is complete and the flags are known.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Decide what to do with unknown kinds (callers check
 *       {@link Envelope#knownKind()} first)</li>
 *   <li>Validate message bodies against the frame grammar</li>
 *   <li>Check cookie origin</li>
 * </ul>
 */
public final class WireMessageDecoder
{
    /**
     * Decodes an envelope of a known kind.
     *
     * @throws WireDecodeException if the kind is unknown or the payload does
     *         not have the shape its kind requires
     */
    public WireMessage decode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        final MessageKind kind = envelope.knownKind().orElseThrow(() ->
                new WireDecodeException("unknown message kind 0x" + Integer.toHexString(envelope.kind())));

        final Cookie cookie = envelope.cookie();
        final ByteBuffer payload = ByteBuffer.wrap(envelope.payload()).order(ByteOrder.LITTLE_ENDIAN);

        switch (kind) {
            case CONNECTED:
                requireEmpty(kind, payload);
                return new Connected(cookie);

            case UNKNOWN_EVENT:
                requireEmpty(kind, payload);
                return new UnknownEvent(cookie);

            case SEND_MESSAGE:
                return new SendMessage(cookie, remaining(payload));

            case MESSAGE_RECEIVED: {
                final long id = readVarint(kind, payload);
                requireEmpty(kind, payload);
                return new MessageReceived(cookie, id);
            }

            case MESSAGE_INVALID:
                if (!payload.hasRemaining()) {
                    return new MessageInvalid(cookie, Optional.empty());
                }
                return new MessageInvalid(cookie, Optional.of(readUtf8(kind, payload)));

            case NEW_MESSAGE: {
                final long id = readVarint(kind, payload);
                final long user = readVarint(kind, payload);
                if (payload.remaining() < Long.BYTES) {
                    throw new WireDecodeException(kind + " payload ends before its timestamp");
                }
                final Instant timestamp = Instant.ofEpochSecond(payload.getLong());
                return new NewMessage(cookie, id, user, timestamp, remaining(payload));
            }

            default:
                throw new WireDecodeException("no decoding for " + kind);
        }
    }

    private static long readVarint(MessageKind kind, ByteBuffer payload) {
        try {
            return Leb128.read(payload);
        } catch (Leb128Exception e) {
            throw new WireDecodeException(kind + " payload: " + e.getMessage(), e);
        }
    }

    private static String readUtf8(MessageKind kind, ByteBuffer payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(payload)
                    .toString();
        } catch (CharacterCodingException e) {
            throw new WireDecodeException(kind + " payload is not valid UTF-8", e);
        }
    }

    private static void requireEmpty(MessageKind kind, ByteBuffer payload) {
        if (payload.hasRemaining()) {
            throw new WireDecodeException(kind + " payload has " + payload.remaining() + " unexpected bytes");
        }
    }

    private static byte[] remaining(ByteBuffer payload) {
        final byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        return bytes;
    }
}

package com.questrail.conversation.protocol.envelope;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * One unit exchanged over a conversation connection: a fixed header
 * {@code (cookie, kind, flags)} and an opaque payload.
 *
 * <p>{@code kind} is kept as the raw unsigned 16-bit code so that envelopes of
 * kinds this side does not know can still be represented and answered. Use
 * {@link #knownKind()} to classify it.</p>
 *
 * <p>The payload array is copied on the way in and on the way out.</p>
 */
public record Envelope(Cookie cookie, int kind, Set<EnvelopeFlag> flags, byte[] payload)
{
    public Envelope
    {
        Objects.requireNonNull(cookie, "cookie");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(payload, "payload");
        if (kind < 0 || kind > 0xFFFF) {
            throw new IllegalArgumentException("kind must be an unsigned 16-bit value: " + kind);
        }
        flags = Set.copyOf(flags);
        payload = payload.clone();
    }

    public Envelope(Cookie cookie, MessageKind kind, Set<EnvelopeFlag> flags, byte[] payload)
    {
        this(cookie, kind.code(), flags, payload);
    }

    @Override
    public byte[] payload()
    {
        return payload.clone();
    }

    public Optional<MessageKind> knownKind()
    {
        return MessageKind.fromCode(kind);
    }

    public boolean has(EnvelopeFlag flag)
    {
        return flags.contains(flag);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Envelope other)) {
            return false;
        }
        return kind == other.kind
                && cookie.equals(other.cookie)
                && flags.equals(other.flags)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(cookie, kind, flags) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString()
    {
        return "Envelope[cookie=" + cookie
                + ", kind=0x" + Integer.toHexString(kind)
                + ", flags=" + flags
                + ", payload=" + payload.length + " bytes]";
    }
}

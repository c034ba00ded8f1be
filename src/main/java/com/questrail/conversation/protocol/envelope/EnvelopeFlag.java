package com.questrail.conversation.protocol.envelope;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-envelope processing flags, carried as a 16-bit little-endian bitset.
 */
public enum EnvelopeFlag
{
    /** The receiver must understand this kind or abort the connection. */
    MUST_PROCESS(0x0001),

    /**
     * The receiver must not process further inbound envelopes until it has
     * replied to this one.
     */
    RESPONSE_REQUIRED(0x0002);

    public static final int KNOWN_BITS = 0x0003;

    private final int bit;

    EnvelopeFlag(int bit)
    {
        this.bit = bit;
    }

    public int bit()
    {
        return bit;
    }

    /**
     * Decode a bitset. Bits outside {@link #KNOWN_BITS} are ignored; callers
     * that must reject them check {@link #KNOWN_BITS} first.
     */
    public static Set<EnvelopeFlag> fromBits(int bits)
    {
        final EnumSet<EnvelopeFlag> flags = EnumSet.noneOf(EnvelopeFlag.class);
        for (EnvelopeFlag flag : values()) {
            if ((bits & flag.bit) != 0) {
                flags.add(flag);
            }
        }
        return Collections.unmodifiableSet(flags);
    }

    public static int toBits(Set<EnvelopeFlag> flags)
    {
        int bits = 0;
        for (EnvelopeFlag flag : flags) {
            bits |= flag.bit;
        }
        return bits;
    }
}

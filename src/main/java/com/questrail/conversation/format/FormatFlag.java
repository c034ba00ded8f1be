package com.questrail.conversation.format;

import java.util.EnumSet;
import java.util.Set;

/**
 * Inline formatting flags carried by {@link FrameType#PUSH_FORMAT} and
 * {@link FrameType#POP_FORMAT} frames as a 16-bit bitset.
 */
public enum FormatFlag
{
    EMPHASIS(0x0001),
    STRONG(0x0002);

    /** Union of all known bits. */
    public static final int KNOWN_BITS = 0x0003;

    private final int bit;

    FormatFlag(int bit)
    {
        this.bit = bit;
    }

    public int bit()
    {
        return bit;
    }

    /** Bits of {@code bits} that no known flag accounts for. */
    public static int unknownBits(int bits)
    {
        return bits & 0xFFFF & ~KNOWN_BITS;
    }

    /**
     * Expand a bitset into flags. Unknown bits are dropped, so callers must
     * check {@link #unknownBits(int)} first when they need to reject them.
     */
    public static EnumSet<FormatFlag> fromBits(int bits)
    {
        EnumSet<FormatFlag> flags = EnumSet.noneOf(FormatFlag.class);
        for (FormatFlag flag : values()) {
            if ((bits & flag.bit) != 0) {
                flags.add(flag);
            }
        }
        return flags;
    }

    public static int toBits(Set<FormatFlag> flags)
    {
        int bits = 0;
        for (FormatFlag flag : flags) {
            bits |= flag.bit;
        }
        return bits;
    }
}

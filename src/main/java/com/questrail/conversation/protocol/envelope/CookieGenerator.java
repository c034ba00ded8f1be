package com.questrail.conversation.protocol.envelope;

/**
 * CookieGenerator
 * -----------------------------------------------------------------------------
 * Monotonic, origin-tagged cookie source.
 *
 * <p>Each generator counts from zero in the low 63 bits and tags every value
 * with its origin. A generator never returns the same cookie twice; once the
 * 63-bit space is used up {@link #next()} fails instead of wrapping.</p>
 *
 * <p>Not thread-safe. A generator belongs to one connection and is only
 * touched from that connection's execution context.</p>
 */
public final class CookieGenerator
{
    private static final long MAX_SEQUENCE = ~Cookie.SERVER_BIT;

    private final long originBit;
    private long sequence;
    private boolean exhausted;

    private CookieGenerator(long originBit)
    {
        this.originBit = originBit;
    }

    /** Generator for cookies of server-initiated events. */
    public static CookieGenerator forServer()
    {
        return new CookieGenerator(Cookie.SERVER_BIT);
    }

    /** Generator for cookies of client-initiated requests. */
    public static CookieGenerator forClient()
    {
        return new CookieGenerator(0L);
    }

    public Cookie next()
    {
        if (exhausted) {
            throw new IllegalStateException("cookie space exhausted");
        }

        final long value = sequence | originBit;
        if (sequence == MAX_SEQUENCE) {
            exhausted = true;
        } else {
            sequence++;
        }
        return new Cookie(value);
    }

    /** Start counting at {@code sequence}. Intended for tests. */
    CookieGenerator startingAt(long sequence)
    {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must fit in 63 bits");
        }
        this.sequence = sequence;
        this.exhausted = false;
        return this;
    }
}

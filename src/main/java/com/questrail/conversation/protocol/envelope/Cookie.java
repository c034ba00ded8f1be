package com.questrail.conversation.protocol.envelope;

/**
 * Correlation id pairing a request envelope with its reply.
 *
 * <p>Bit 63 records which side issued the cookie, so client and server
 * cookies cannot collide on one connection. A reply always carries the
 * cookie of the request it answers.</p>
 *
 * @param value raw 64-bit wire value
 */
public record Cookie(long value)
{
    public static final long SERVER_BIT = 0x8000_0000_0000_0000L;

    /** Issued by the server, for a server-initiated event. */
    public boolean isServer()
    {
        return (value & SERVER_BIT) != 0;
    }

    /** Issued by the client, for a client-initiated request. */
    public boolean isClient()
    {
        return (value & SERVER_BIT) == 0;
    }

    /** The counter part of the cookie, without the origin bit. */
    public long sequence()
    {
        return value & ~SERVER_BIT;
    }

    @Override
    public String toString()
    {
        return (isServer() ? "S:" : "C:") + sequence();
    }
}

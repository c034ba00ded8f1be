package com.questrail.conversation.protocol.envelope;

/**
 * WebSocket close codes used by the conversation protocol.
 *
 * <p>Codes below 4000 are the RFC 6455 registered codes; the 4xxx range is
 * private to this protocol.</p>
 */
public final class CloseCodes
{
    public static final int NORMAL = 1000;
    public static final int UNSUPPORTED_DATA = 1003;
    public static final int INTERNAL_ERROR = 1011;

    /** The envelope header is truncated or its declared length is wrong. */
    public static final int MALFORMED_ENVELOPE = 4000;

    /** The peer sent a {@code MUST_PROCESS} kind this side does not handle. */
    public static final int UNSUPPORTED_MANDATORY_KIND = 4001;

    /** The user may not join the requested conversation. */
    public static final int ACCESS_DENIED = 4003;

    /** The envelope carries flag bits this protocol does not define. */
    public static final int BAD_FLAGS = 4004;

    private CloseCodes() {}
}

package com.questrail.conversation.protocol.codec.impl;

/**
 * Fixed offsets of the envelope header.
 */
final class EnvelopeLayout
{
    static final int COOKIE_OFFSET = 0;
    static final int KIND_OFFSET = 8;
    static final int FLAGS_OFFSET = 10;

    /** Size of the fixed part of the header, before the payload length. */
    static final int FIXED_HEADER_LENGTH = 12;

    private EnvelopeLayout() {}
}

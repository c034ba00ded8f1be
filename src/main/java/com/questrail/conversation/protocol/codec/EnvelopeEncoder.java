package com.questrail.conversation.protocol.codec;

import com.questrail.conversation.protocol.envelope.Envelope;

/**
 * Byte-level encoder for conversation envelopes; the inverse of
 * {@link EnvelopeDecoder}.
 */
public interface EnvelopeEncoder
{
    byte[] encode(Envelope envelope);
}

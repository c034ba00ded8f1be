package com.questrail.conversation.protocol.codec;

import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeParseException;

/**
 * EnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for conversation envelopes.
 *
 * <p>The decoder is responsible only for the envelope header and the payload
 * length. It does not interpret the kind or the payload; a structurally valid
 * envelope of an unknown kind decodes successfully.</p>
 */
public interface EnvelopeDecoder
{
    /**
     * Decode exactly one envelope from one complete binary WebSocket message.
     *
     * @param message raw bytes received from the transport
     * @return the decoded envelope
     * @throws EnvelopeParseException if the bytes are not a well-formed
     *         envelope; the exception's reason names the close code
     */
    Envelope decode(byte[] message) throws EnvelopeParseException;
}

package com.questrail.conversation.protocol.envelope;

import java.util.Objects;

/**
 * An inbound binary frame is not a structurally valid envelope.
 *
 * <p>Envelope errors are fatal to the connection: the receiver closes it with
 * {@link Reason#closeCode()}.</p>
 */
public final class EnvelopeParseException extends Exception
{
    public enum Reason
    {
        /** Fewer bytes than the fixed header, or a truncated length field. */
        UNDERFLOW(CloseCodes.MALFORMED_ENVELOPE),
        /** The declared payload length does not match the bytes present. */
        LENGTH_MISMATCH(CloseCodes.MALFORMED_ENVELOPE),
        /** Flag bits outside {@link EnvelopeFlag#KNOWN_BITS}. */
        BAD_FLAGS(CloseCodes.BAD_FLAGS);

        private final int closeCode;

        Reason(int closeCode)
        {
            this.closeCode = closeCode;
        }

        public int closeCode()
        {
            return closeCode;
        }
    }

    private final Reason reason;

    public EnvelopeParseException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason()
    {
        return reason;
    }
}

package com.questrail.conversation.internal.decode;

/**
 * Indicates that a structurally valid envelope of a known kind could not be
 * translated into a {@link com.questrail.conversation.protocol.model.WireMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>A kind code this side does not implement</li>
 *   <li>A payload of the wrong shape for its kind</li>
 *   <li>Malformed text in a diagnostic</li>
 * </ul>
 */
public final class WireDecodeException extends RuntimeException
{
    public WireDecodeException(String message) {
        super(message);
    }

    public WireDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.conversation.observability;

import java.time.Instant;

/**
 * Record representing an event the broker could not hand to a listener. The
 * listener is disconnected as a result.
 *
 * @param cause the exception thrown by the listener, or {@code null} if it
 *              refused the event
 */
public record DeliveryFailureEvent(
    Instant timestamp,
    long conversation,
    long listenerUser,
    long eventId,
    Throwable cause
) {
}

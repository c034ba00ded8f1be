package com.questrail.conversation.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the conversation stack.
 */
public record ConversationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

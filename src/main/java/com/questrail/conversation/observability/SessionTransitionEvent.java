package com.questrail.conversation.observability;

import com.questrail.conversation.session.SessionState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of a client session.
 */
public record SessionTransitionEvent(
    Instant timestamp,
    long conversation,
    long user,
    SessionState oldState,
    SessionState newState
) {
}

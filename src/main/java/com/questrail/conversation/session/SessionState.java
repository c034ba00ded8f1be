package com.questrail.conversation.session;

/**
 * Lifecycle of a {@link ClientSession}. Transitions only move forward.
 */
public enum SessionState
{
    /** Waiting for the broker to accept the connection. */
    STARTING,
    /** Joined; inbound envelopes are processed and events pushed. */
    ACTIVE,
    /** Shutting down; no further inbound processing. */
    STOPPING,
    /** Disconnected from the broker and the transport. */
    STOPPED
}

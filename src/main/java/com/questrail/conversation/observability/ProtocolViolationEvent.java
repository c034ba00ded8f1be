package com.questrail.conversation.observability;

import java.time.Instant;

/**
 * Record representing a peer protocol violation that closed its connection.
 *
 * @param closeCode WebSocket close code sent to the peer
 * @param detail    what the peer got wrong
 */
public record ProtocolViolationEvent(
    Instant timestamp,
    long conversation,
    long user,
    int closeCode,
    String detail
) {
}

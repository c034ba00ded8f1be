package com.questrail.conversation.api;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandshakeRequestTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link HandshakeRequest} and {@link NewMessageNotice}.
 */
final class HandshakeRequestTest
{
    @Test
    void headerLookupIgnoresCase()
    {
        HandshakeRequest request = new HandshakeRequest(7, Map.of("Authorization", "Bearer x"));

        assertEquals("Bearer x", request.header("authorization").orElseThrow());
        assertEquals("Bearer x", request.header("AUTHORIZATION").orElseThrow());
        assertTrue(request.header("cookie").isEmpty());
    }

    @Test
    void headersAreSnapshotted()
    {
        Map<String, String> headers = new HashMap<>();
        headers.put("X-User", "1");
        HandshakeRequest request = new HandshakeRequest(7, headers);

        headers.put("X-User", "2");

        assertEquals("1", request.header("x-user").orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> request.headers().put("a", "b"));
    }

    @Test
    void noticeIsMentionedOnlyForMentionedRecipient()
    {
        ConversationEvent event = new ConversationEvent(7, 1, 2, Instant.EPOCH, new byte[0]);

        assertTrue(NewMessageNotice.of(3, event, List.of(3L, 4L)).mentioned());
        assertFalse(NewMessageNotice.of(5, event, List.of(3L, 4L)).mentioned());
    }
}

package com.questrail.conversation.observability;

import com.questrail.conversation.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConversationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConversationObservabilitySink implements ConversationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConversationObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        // Joins and leaves are interesting; the intermediate STOPPING step is not.
        if (event.newState() == SessionState.ACTIVE || event.newState() == SessionState.STOPPED) {
            log.info("Conversation {} user {}: {} -> {}",
                event.conversation(),
                event.user(),
                event.oldState(),
                event.newState());
        } else {
            log.debug("Conversation {} user {}: {} -> {}",
                event.conversation(),
                event.user(),
                event.oldState(),
                event.newState());
        }
    }

    @Override
    public void onProtocolViolation(ProtocolViolationEvent event) {
        log.warn("Conversation {} user {}: closing with {} ({})",
            event.conversation(),
            event.user(),
            event.closeCode(),
            event.detail());
    }

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {
        if (event.cause() != null) {
            log.warn("Conversation {}: could not deliver event {} to user {}, disconnecting",
                event.conversation(), event.eventId(), event.listenerUser(), event.cause());
        } else {
            log.warn("Conversation {}: user {} refused event {}, disconnecting",
                event.conversation(), event.listenerUser(), event.eventId());
        }
    }

    @Override
    public void onError(ConversationErrorEvent event) {
        log.error("Conversation error: {}", event.message(), event.cause());
    }
}

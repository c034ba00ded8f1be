package com.questrail.conversation.observability;

/**
 * Main interface for receiving conversation observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods are called from broker and session threads and must not block.</p>
 */
public interface ConversationObservabilitySink {
    /**
     * Called when a client session changes lifecycle state.
     * @param event the transition details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when a connection is closed because its peer broke the protocol.
     * @param event the violation
     */
    void onProtocolViolation(ProtocolViolationEvent event);

    /**
     * Called when the broker fails to deliver an event to a listener.
     * @param event the failed delivery
     */
    void onDeliveryFailure(DeliveryFailureEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(ConversationErrorEvent event);
}

package com.questrail.conversation.observability;

/**
 * No-op implementation of ConversationObservabilitySink.
 */
public final class NullObservabilitySink implements ConversationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {}

    @Override
    public void onProtocolViolation(ProtocolViolationEvent event) {}

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {}

    @Override
    public void onError(ConversationErrorEvent event) {}
}

package com.questrail.conversation.session;

import com.questrail.conversation.api.ConversationEvent;
import com.questrail.conversation.broker.ConversationAccessException;
import com.questrail.conversation.broker.ConversationBroker;
import com.questrail.conversation.broker.ConversationListener;
import com.questrail.conversation.format.MessageValidationException;
import com.questrail.conversation.internal.decode.WireMessageDecoder;
import com.questrail.conversation.internal.encode.WireMessageEncoder;
import com.questrail.conversation.internal.time.Cancellable;
import com.questrail.conversation.internal.time.MonotonicClock;
import com.questrail.conversation.internal.time.MonotonicScheduler;
import com.questrail.conversation.internal.time.SystemWallClock;
import com.questrail.conversation.internal.time.WallClock;
import com.questrail.conversation.observability.ConversationErrorEvent;
import com.questrail.conversation.observability.ConversationObservabilitySink;
import com.questrail.conversation.observability.NullObservabilitySink;
import com.questrail.conversation.observability.ProtocolViolationEvent;
import com.questrail.conversation.observability.SessionTransitionEvent;
import com.questrail.conversation.protocol.codec.EnvelopeDecoder;
import com.questrail.conversation.protocol.codec.EnvelopeEncoder;
import com.questrail.conversation.protocol.codec.impl.DefaultEnvelopeDecoder;
import com.questrail.conversation.protocol.codec.impl.DefaultEnvelopeEncoder;
import com.questrail.conversation.protocol.envelope.CloseCodes;
import com.questrail.conversation.protocol.envelope.Cookie;
import com.questrail.conversation.protocol.envelope.CookieGenerator;
import com.questrail.conversation.protocol.envelope.Envelope;
import com.questrail.conversation.protocol.envelope.EnvelopeFlag;
import com.questrail.conversation.protocol.envelope.EnvelopeParseException;
import com.questrail.conversation.protocol.envelope.MessageKind;
import com.questrail.conversation.protocol.model.Connected;
import com.questrail.conversation.protocol.model.MessageInvalid;
import com.questrail.conversation.protocol.model.MessageReceived;
import com.questrail.conversation.protocol.model.NewMessage;
import com.questrail.conversation.protocol.model.SendMessage;
import com.questrail.conversation.protocol.model.UnknownEvent;
import com.questrail.conversation.protocol.model.WireMessage;
import com.questrail.conversation.transport.WebSocketConnection;
import com.questrail.conversation.transport.WebSocketConnectionListener;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * ClientSession
 * =============================================================================
 * Protocol endpoint for one live connection of one user to one conversation.
 *
 * <h2>Threading Model</h2>
 * All session state is confined to the session's {@link Executor} (the Netty
 * channel event loop in production). Transport callbacks already arrive on
 * it; broker replies and broker-delivered events are hopped onto it. The only
 * method called from elsewhere is {@link #deliver(ConversationEvent)}, which
 * reads the volatile state and enqueues.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   STARTING  → connect sent to the broker; inbound frames and events are queued
 *   ACTIVE    → Connected sent, keep-alive armed, inbound frames processed
 *   STOPPING  → keep-alive cancelled, disconnect sent, transport closed
 *   STOPPED   → terminal
 * </pre>
 *
 * <h2>Inbound Ordering</h2>
 * Inbound frames are processed in arrival order. While a request flagged
 * {@link EnvelopeFlag#RESPONSE_REQUIRED} is outstanding, later frames stay
 * queued (and the transport is asked to stop reading) until its reply has
 * been sent. Requests without the flag are pipelined: their replies may
 * interleave with the processing of later frames.
 *
 * <h2>Error Policy</h2>
 * <ul>
 *   <li>Malformed envelope: close with the parse reason's code</li>
 *   <li>Text message: close with {@link CloseCodes#UNSUPPORTED_DATA}</li>
 *   <li>Unhandled kind with {@code MUST_PROCESS}: close with
 *       {@link CloseCodes#UNSUPPORTED_MANDATORY_KIND}</li>
 *   <li>Unhandled kind without it: reply {@code UNKNOWN_EVENT}</li>
 *   <li>Invalid message body: reply {@code MESSAGE_INVALID}, stay open</li>
 *   <li>Broker or store failure: reply {@code MESSAGE_INVALID "internal error"}</li>
 * </ul>
 */
public final class ClientSession implements WebSocketConnectionListener, ConversationListener {

    static final String INTERNAL_ERROR_DIAGNOSTIC = "internal error";

    private final long conversation;
    private final long user;
    private final WebSocketConnection connection;
    private final ConversationBroker broker;
    private final Executor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration keepAliveInterval;
    private final ConversationObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final EnvelopeDecoder envelopeDecoder = new DefaultEnvelopeDecoder();
    private final EnvelopeEncoder envelopeEncoder = new DefaultEnvelopeEncoder();
    private final WireMessageDecoder messageDecoder = new WireMessageDecoder();
    private final WireMessageEncoder messageEncoder = new WireMessageEncoder();
    private final CookieGenerator cookies = CookieGenerator.forServer();

    // Executor-confined.
    private final ArrayDeque<InboundFrame> inbound = new ArrayDeque<>();
    private final ArrayDeque<ConversationEvent> pendingEvents = new ArrayDeque<>();
    private boolean suspended;
    private boolean draining;
    private Cancellable keepAlive;

    private volatile SessionState state = SessionState.STARTING;

    public ClientSession(long conversation,
                         long user,
                         WebSocketConnection connection,
                         ConversationBroker broker,
                         Executor executor,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         Duration keepAliveInterval,
                         ConversationObservabilitySink observabilitySink)
    {
        this(conversation, user, connection, broker, executor, scheduler, clock,
                keepAliveInterval, observabilitySink, null);
    }

    public ClientSession(long conversation,
                         long user,
                         WebSocketConnection connection,
                         ConversationBroker broker,
                         Executor executor,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         Duration keepAliveInterval,
                         ConversationObservabilitySink observabilitySink,
                         WallClock wallClock)
    {
        this.conversation = conversation;
        this.user = user;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.broker = Objects.requireNonNull(broker, "broker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.keepAliveInterval = Objects.requireNonNull(keepAliveInterval, "keepAliveInterval");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNullElse(wallClock, SystemWallClock.INSTANCE);
    }

    /**
     * Ask the broker to join this session to its conversation. The rest of the
     * start-up happens on the executor once the broker answers.
     */
    public void start() {
        broker.connect(user, conversation, this)
                .whenCompleteAsync((ignored, error) -> onConnectResult(error), executor);
    }

    public long conversation() {
        return conversation;
    }

    public long user() {
        return user;
    }

    public SessionState state() {
        return state;
    }

    // -------------------------------------------------------------------------
    // Broker side
    // -------------------------------------------------------------------------

    @Override
    public boolean deliver(ConversationEvent event) {
        Objects.requireNonNull(event, "event");

        final SessionState s = state;
        if (s == SessionState.STOPPING || s == SessionState.STOPPED) {
            return false;
        }

        try {
            executor.execute(() -> push(event));
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void push(ConversationEvent event) {
        if (state == SessionState.STARTING) {
            // Held until Connected has gone out.
            pendingEvents.add(event);
            return;
        }
        if (state != SessionState.ACTIVE) {
            return;
        }
        sendEvent(event);
    }

    private void sendEvent(ConversationEvent event) {
        send(new NewMessage(cookies.next(), event.id(), event.user(), event.timestamp(), event.body()));
    }

    private void onConnectResult(Throwable error) {
        if (state != SessionState.STARTING) {
            // Stopped while the broker was answering; stop() already queued the disconnect.
            return;
        }

        if (error != null) {
            final Throwable cause = unwrap(error);
            if (cause instanceof ConversationAccessException denied) {
                stop(CloseCodes.ACCESS_DENIED, denied.reason().name());
            } else {
                reportError("Could not join conversation " + conversation, cause);
                stop(CloseCodes.INTERNAL_ERROR, INTERNAL_ERROR_DIAGNOSTIC);
            }
            return;
        }

        send(new Connected(cookies.next()));
        transition(SessionState.ACTIVE);
        while (!pendingEvents.isEmpty()) {
            sendEvent(pendingEvents.poll());
        }
        armKeepAlive();
        drain();
    }

    // -------------------------------------------------------------------------
    // Transport side
    // -------------------------------------------------------------------------

    @Override
    public void onBinary(byte[] payload) {
        enqueue(new InboundFrame.Binary(payload));
    }

    @Override
    public void onText(String text) {
        enqueue(new InboundFrame.Text(text));
    }

    @Override
    public void onPing() {}

    @Override
    public void onPong() {}

    @Override
    public void onClose(int code) {
        stop(CloseCodes.NORMAL, "");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null && state != SessionState.STOPPED) {
            reportError("Transport failed for user " + user + " in conversation " + conversation, cause);
        }
        stop(CloseCodes.INTERNAL_ERROR, "");
    }

    private void enqueue(InboundFrame frame) {
        if (state == SessionState.STOPPING || state == SessionState.STOPPED) {
            return;
        }
        inbound.add(frame);
        drain();
    }

    /**
     * Process queued frames until the queue is empty, a response-required
     * request is outstanding, or the session leaves {@code ACTIVE}.
     */
    private void drain() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            while (state == SessionState.ACTIVE && !suspended && !inbound.isEmpty()) {
                process(inbound.poll());
            }
        } finally {
            draining = false;
        }
    }

    private void process(InboundFrame frame) {
        if (frame instanceof InboundFrame.Text) {
            violation(CloseCodes.UNSUPPORTED_DATA, "text messages are not supported");
            return;
        }

        final byte[] payload = ((InboundFrame.Binary) frame).payload();

        final Envelope envelope;
        try {
            envelope = envelopeDecoder.decode(payload);
        } catch (EnvelopeParseException e) {
            violation(e.reason().closeCode(), e.getMessage());
            return;
        }

        if (envelope.cookie().isServer()) {
            // A reply to one of our own events; none of them expects an answer.
            return;
        }

        final Optional<MessageKind> kind = envelope.knownKind();
        if (kind.isPresent() && kind.get() == MessageKind.SEND_MESSAGE) {
            sendMessage(envelope);
        } else if (kind.isPresent() && kind.get() == MessageKind.UNKNOWN_EVENT) {
            return;
        } else if (envelope.has(EnvelopeFlag.MUST_PROCESS)) {
            violation(CloseCodes.UNSUPPORTED_MANDATORY_KIND,
                    "cannot process kind 0x" + Integer.toHexString(envelope.kind()));
        } else {
            send(new UnknownEvent(envelope.cookie()));
        }
    }

    private void sendMessage(Envelope envelope) {
        final SendMessage request = (SendMessage) messageDecoder.decode(envelope);
        final boolean responseRequired = envelope.has(EnvelopeFlag.RESPONSE_REQUIRED);

        if (responseRequired) {
            suspended = true;
            connection.pauseInbound();
        }

        broker.newMessage(conversation, user, request.body())
                .whenCompleteAsync((id, error) -> onMessageResult(request.cookie(), responseRequired, id, error),
                        executor);
    }

    private void onMessageResult(Cookie cookie, boolean responseRequired, Long id, Throwable error) {
        if (state != SessionState.ACTIVE) {
            return;
        }

        if (error == null) {
            send(new MessageReceived(cookie, id));
        } else {
            final Throwable cause = unwrap(error);
            if (cause instanceof MessageValidationException invalid) {
                send(MessageInvalid.of(cookie, "malformed message: " + invalid.getMessage()));
            } else {
                reportError("Could not add message to conversation " + conversation, cause);
                send(MessageInvalid.of(cookie, INTERNAL_ERROR_DIAGNOSTIC));
            }
        }

        if (responseRequired) {
            suspended = false;
            connection.resumeInbound();
            drain();
        }
    }

    // -------------------------------------------------------------------------
    // Keep-alive
    // -------------------------------------------------------------------------

    private void armKeepAlive() {
        keepAlive = scheduler.scheduleAfter(keepAliveInterval, clock, () -> {
            try {
                executor.execute(this::keepAliveTick);
            } catch (RejectedExecutionException e) {
                // The connection's event loop is gone, and with it the connection.
                reportError("Keep-alive dropped for user " + user + " in conversation " + conversation, e);
            }
        });
    }

    private void keepAliveTick() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        connection.sendPing();
        armKeepAlive();
    }

    // -------------------------------------------------------------------------
    // Shutdown
    // -------------------------------------------------------------------------

    private void violation(int closeCode, String detail) {
        observabilitySink.onProtocolViolation(new ProtocolViolationEvent(
                wallClock.now(), conversation, user, closeCode, detail));
        stop(closeCode, detail);
    }

    private void stop(int closeCode, String reason) {
        if (state == SessionState.STOPPING || state == SessionState.STOPPED) {
            return;
        }
        transition(SessionState.STOPPING);

        if (keepAlive != null) {
            keepAlive.cancel();
            keepAlive = null;
        }
        inbound.clear();
        pendingEvents.clear();

        broker.disconnect(conversation, this);
        connection.close(closeCode, reason);

        transition(SessionState.STOPPED);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private void send(WireMessage message) {
        connection.sendBinary(envelopeEncoder.encode(messageEncoder.encode(message)));
    }

    private void transition(SessionState newState) {
        final SessionState oldState = state;
        state = newState;
        observabilitySink.onSessionTransition(new SessionTransitionEvent(
                wallClock.now(), conversation, user, oldState, newState));
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new ConversationErrorEvent(wallClock.now(), message, cause));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private sealed interface InboundFrame {
        record Binary(byte[] payload) implements InboundFrame {}

        record Text(String text) implements InboundFrame {}
    }
}

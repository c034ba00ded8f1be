package com.questrail.conversation.broker;

import com.questrail.conversation.api.ConversationEvent;
import com.questrail.conversation.api.ConversationNotFoundException;
import com.questrail.conversation.api.MemberNotifier;
import com.questrail.conversation.api.MessageStore;
import com.questrail.conversation.api.MessageStoreException;
import com.questrail.conversation.api.NewMessageNotice;
import com.questrail.conversation.api.PersistedMessage;
import com.questrail.conversation.format.MessageValidationException;
import com.questrail.conversation.format.MessageValidator;
import com.questrail.conversation.format.Validation;
import com.questrail.conversation.internal.time.SystemWallClock;
import com.questrail.conversation.internal.time.WallClock;
import com.questrail.conversation.observability.ConversationErrorEvent;
import com.questrail.conversation.observability.ConversationObservabilitySink;
import com.questrail.conversation.observability.DeliveryFailureEvent;
import com.questrail.conversation.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DefaultConversationBroker
 * =============================================================================
 * {@link ConversationBroker} running a serialized command loop on one thread.
 *
 * <h2>Threading Model</h2>
 * Every operation is turned into a {@link BrokerCommand} and queued. A single
 * thread takes commands one at a time, so the listener map needs no locking
 * and all operations are totally ordered:
 * <ul>
 *   <li>The listener map is only touched on the broker thread</li>
 *   <li>{@link MessageStore} and {@link MemberNotifier} are called on the broker thread</li>
 *   <li>Listener {@link ConversationListener#deliver deliver} calls happen on the broker thread</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   broker.start()          → starts the command loop thread
 *   broker.newMessage(...)  → enqueues a command, returns its future
 *   broker.stop()           → stops the loop, fails queued commands
 * </pre>
 *
 * Commands submitted while the broker is not running fail their future with
 * {@link IllegalStateException}.
 *
 * <h2>Membership</h2>
 * The first {@code connect} to a conversation loads its members from the
 * {@link MessageStore} and caches them until the last listener leaves.
 * Membership changes made in the store while a conversation has listeners are
 * therefore not seen until it goes idle.
 */
public final class DefaultConversationBroker implements ConversationBroker {

    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final MessageStore store;
    private final MemberNotifier notifier;
    private final MessageValidator validator;
    private final ConversationObservabilitySink observabilitySink;
    private final WallClock wallClock;
    private final Duration shutdownTimeout;

    private final BlockingQueue<BrokerCommand<?>> commands = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    // Broker thread only.
    private final Map<Long, ConversationEntry> conversations = new HashMap<>();

    private volatile Thread loopThread;

    public DefaultConversationBroker(MessageStore store,
                                     MemberNotifier notifier,
                                     ConversationObservabilitySink observabilitySink,
                                     WallClock wallClock,
                                     Duration shutdownTimeout)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.notifier = Objects.requireNonNullElse(notifier, MemberNotifier.NONE);
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNullElse(wallClock, SystemWallClock.INSTANCE);
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.validator = new MessageValidator();
    }

    public DefaultConversationBroker(MessageStore store) {
        this(store, null, null, null, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * Starts the command loop thread.
     * Idempotent: calling start() on a running broker has no effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running.compareAndSet(false, true)) {
                loopThread = new Thread(this::runCommandLoop, "conversation-broker");
                loopThread.setDaemon(true);
                loopThread.start();
            }
        }
    }

    /**
     * Stops the command loop and waits up to the shutdown timeout for it to
     * finish. Commands still queued fail with {@link IllegalStateException}.
     */
    public void stop() {
        final Thread thread;
        synchronized (lifecycleLock) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            thread = loopThread;
            loopThread = null;
        }

        thread.interrupt();
        try {
            thread.join(shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        final List<BrokerCommand<?>> abandoned = new ArrayList<>();
        commands.drainTo(abandoned);
        for (BrokerCommand<?> command : abandoned) {
            command.result().completeExceptionally(new IllegalStateException("broker stopped"));
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public CompletableFuture<Void> connect(long user, long conversation, ConversationListener listener) {
        Objects.requireNonNull(listener, "listener");
        return submit(new BrokerCommand.Connect(user, conversation, listener, new CompletableFuture<>()));
    }

    @Override
    public CompletableFuture<Void> disconnect(long conversation, ConversationListener listener) {
        Objects.requireNonNull(listener, "listener");
        return submit(new BrokerCommand.Disconnect(conversation, listener, new CompletableFuture<>()));
    }

    @Override
    public CompletableFuture<Long> newMessage(long conversation, long user, byte[] body) {
        Objects.requireNonNull(body, "body");
        return submit(new BrokerCommand.NewMessage(conversation, user, body.clone(), new CompletableFuture<>()));
    }

    @Override
    public CompletableFuture<Map<Long, Integer>> snapshot() {
        return submit(new BrokerCommand.Snapshot(new CompletableFuture<>()));
    }

    private <T> CompletableFuture<T> submit(BrokerCommand<T> command) {
        final CompletableFuture<T> result = command.result();
        synchronized (lifecycleLock) {
            if (running.get()) {
                commands.offer(command);
            } else {
                result.completeExceptionally(new IllegalStateException("broker is not running"));
            }
        }
        return result;
    }

    /**
     * Main command loop - runs on the dedicated broker thread.
     */
    private void runCommandLoop() {
        while (running.get()) {
            final BrokerCommand<?> command;
            try {
                command = commands.take();
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
                continue;
            }

            try {
                process(command);
            } catch (RuntimeException e) {
                command.result().completeExceptionally(e);
                observabilitySink.onError(new ConversationErrorEvent(
                    wallClock.now(),
                    "Broker command failed: " + command.getClass().getSimpleName(),
                    e
                ));
            }
        }
    }

    private void process(BrokerCommand<?> command) {
        if (command instanceof BrokerCommand.Connect connect) {
            handleConnect(connect);
        } else if (command instanceof BrokerCommand.Disconnect disconnect) {
            handleDisconnect(disconnect);
        } else if (command instanceof BrokerCommand.NewMessage newMessage) {
            handleNewMessage(newMessage);
        } else if (command instanceof BrokerCommand.Snapshot snapshot) {
            handleSnapshot(snapshot);
        } else {
            throw new IllegalArgumentException("Unsupported command: " + command.getClass().getName());
        }
    }

    private void handleConnect(BrokerCommand.Connect command) {
        ConversationEntry entry = conversations.get(command.conversation());

        if (entry == null) {
            final Set<Long> members;
            try {
                members = store.members(command.conversation());
            } catch (ConversationNotFoundException e) {
                command.result().completeExceptionally(new ConversationAccessException(
                    ConversationAccessException.Reason.NOT_FOUND, command.conversation(), command.user()));
                return;
            } catch (MessageStoreException e) {
                command.result().completeExceptionally(e);
                return;
            }
            entry = new ConversationEntry(members);
        }

        if (!entry.members.contains(command.user())) {
            command.result().completeExceptionally(new ConversationAccessException(
                ConversationAccessException.Reason.NOT_A_MEMBER, command.conversation(), command.user()));
            return;
        }

        entry.listeners.add(new Listener(command.user(), command.listener()));
        conversations.put(command.conversation(), entry);
        command.result().complete(null);
    }

    private void handleDisconnect(BrokerCommand.Disconnect command) {
        final ConversationEntry entry = conversations.get(command.conversation());
        if (entry != null) {
            entry.listeners.removeIf(l -> l.listener() == command.listener());
            if (entry.listeners.isEmpty()) {
                conversations.remove(command.conversation());
            }
        }
        command.result().complete(null);
    }

    private void handleNewMessage(BrokerCommand.NewMessage command) {
        final long conversation = command.conversation();

        final Validation validation;
        try {
            validation = validator.validateComplete(command.body());
        } catch (MessageValidationException e) {
            command.result().completeExceptionally(e);
            return;
        }

        final PersistedMessage persisted;
        try {
            persisted = store.persist(conversation, command.user(), validation.body());
        } catch (MessageStoreException e) {
            command.result().completeExceptionally(e);
            return;
        }

        final ConversationEvent event = new ConversationEvent(
            conversation, persisted.id(), command.user(), persisted.timestamp(), validation.body());

        final ConversationEntry entry = conversations.get(conversation);
        final Set<Long> connected = new HashSet<>();

        if (entry != null) {
            for (Listener listener : entry.listeners) {
                connected.add(listener.user());
                deliver(conversation, listener, event);
            }
        }

        command.result().complete(persisted.id());

        notifyOfflineMembers(entry, event, validation.mentions(), connected);
    }

    private void deliver(long conversation, Listener listener, ConversationEvent event) {
        Throwable cause = null;
        boolean accepted;
        try {
            accepted = listener.listener().deliver(event);
        } catch (RuntimeException e) {
            accepted = false;
            cause = e;
        }

        if (!accepted) {
            observabilitySink.onDeliveryFailure(new DeliveryFailureEvent(
                wallClock.now(), conversation, listener.user(), event.id(), cause));
            // Queued behind the current command, so the fan-out in progress is unaffected.
            submit(new BrokerCommand.Disconnect(conversation, listener.listener(), new CompletableFuture<>()));
        }
    }

    private void notifyOfflineMembers(ConversationEntry entry,
                                      ConversationEvent event,
                                      List<Long> mentions,
                                      Set<Long> connected) {
        final Set<Long> members;
        if (entry != null) {
            members = entry.members;
        } else {
            try {
                members = store.members(event.conversation());
            } catch (MessageStoreException e) {
                observabilitySink.onError(new ConversationErrorEvent(
                    wallClock.now(),
                    "Could not load members of conversation " + event.conversation() + " for notification",
                    e
                ));
                return;
            }
        }

        for (Long member : members) {
            if (member == event.user() || connected.contains(member)) {
                continue;
            }
            try {
                notifier.notifyNewMessage(NewMessageNotice.of(member, event, mentions));
            } catch (RuntimeException e) {
                observabilitySink.onError(new ConversationErrorEvent(
                    wallClock.now(),
                    "Could not notify user " + member + " of message " + event.id(),
                    e
                ));
            }
        }
    }

    private void handleSnapshot(BrokerCommand.Snapshot command) {
        final Map<Long, Integer> counts = new HashMap<>();
        conversations.forEach((id, entry) -> counts.put(id, entry.listeners.size()));
        command.result().complete(Map.copyOf(counts));
    }

    private static final class ConversationEntry {
        private final Set<Long> members;
        private final List<Listener> listeners = new ArrayList<>();

        private ConversationEntry(Set<Long> members) {
            this.members = Set.copyOf(members);
        }
    }

    private record Listener(long user, ConversationListener listener) {}
}

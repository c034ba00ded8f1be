package com.questrail.conversation.broker;

import com.questrail.conversation.api.ConversationEvent;
import com.questrail.conversation.api.ConversationNotFoundException;
import com.questrail.conversation.api.MessageStoreException;
import com.questrail.conversation.api.NewMessageNotice;
import com.questrail.conversation.format.MessageBuilder;
import com.questrail.conversation.format.MessageValidationException;
import com.questrail.conversation.format.ValidationError;
import com.questrail.conversation.observability.DeliveryFailureEvent;
import com.questrail.conversation.observability.RecordingObservabilitySink;
import com.questrail.conversation.store.InMemoryMessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultConversationBrokerTest
 * -----------------------------------------------------------------------------
 * Tests for {@link DefaultConversationBroker} against an in-memory store.
 *
 * The broker runs its real command loop; tests wait on the returned futures.
 * A trailing {@code snapshot()} is used as a barrier: it is processed only
 * after every command submitted before it, including follow-up work.
 */
final class DefaultConversationBrokerTest {

    private static final long ALICE = 1;
    private static final long BOB = 2;
    private static final long CAROL = 3;
    private static final long MALLORY = 66;

    private static final byte[] HELLO = MessageBuilder.message().paragraph().text("hello").build();

    private InMemoryMessageStore store;
    private RecordingObservabilitySink sink;
    private List<NewMessageNotice> notices;
    private DefaultConversationBroker broker;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore()
                .withConversation(7, ALICE, BOB, CAROL)
                .withConversation(8, ALICE, BOB);
        sink = new RecordingObservabilitySink();
        notices = new CopyOnWriteArrayList<>();
        broker = new DefaultConversationBroker(store, notices::add, sink, null, Duration.ofSeconds(2));
        broker.start();
    }

    @AfterEach
    void tearDown() {
        broker.stop();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private Map<Long, Integer> barrier() throws Exception {
        return await(broker.snapshot());
    }

    @Test
    void messageFansOutToListenersOfSameConversationOnly() throws Exception {
        RecordingListener bobIn7 = new RecordingListener();
        RecordingListener aliceIn8 = new RecordingListener();
        await(broker.connect(BOB, 7, bobIn7));
        await(broker.connect(ALICE, 8, aliceIn8));

        long id = await(broker.newMessage(7, ALICE, HELLO));

        assertEquals(1, bobIn7.events.size());
        ConversationEvent event = bobIn7.events.get(0);
        assertEquals(id, event.id());
        assertEquals(7, event.conversation());
        assertEquals(ALICE, event.user());
        assertEquals(InMemoryMessageStore.TIMESTAMP, event.timestamp());
        assertArrayEquals(HELLO, event.body());
        assertTrue(aliceIn8.events.isEmpty());
    }

    @Test
    void authorReceivesOwnMessageOnEveryConnection() throws Exception {
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        await(broker.connect(ALICE, 7, first));
        await(broker.connect(ALICE, 7, second));

        await(broker.newMessage(7, ALICE, HELLO));

        assertEquals(1, first.events.size());
        assertEquals(1, second.events.size());
    }

    @Test
    void eventIdsFollowStoreOrder() throws Exception {
        RecordingListener bob = new RecordingListener();
        await(broker.connect(BOB, 7, bob));

        long first = await(broker.newMessage(7, ALICE, HELLO));
        long second = await(broker.newMessage(7, CAROL, HELLO));

        assertTrue(second > first);
        assertEquals(List.of(first, second), List.of(bob.events.get(0).id(), bob.events.get(1).id()));
    }

    @Test
    void disconnectRemovesListenerAndEmptyConversation() throws Exception {
        RecordingListener bob = new RecordingListener();
        await(broker.connect(BOB, 7, bob));
        assertEquals(Map.of(7L, 1), barrier());

        await(broker.disconnect(7, bob));
        await(broker.newMessage(7, ALICE, HELLO));

        assertTrue(bob.events.isEmpty());
        assertEquals(Map.of(), barrier());
    }

    @Test
    void disconnectMatchesListenerIdentity() throws Exception {
        RecordingListener bob = new RecordingListener();
        await(broker.connect(BOB, 7, bob));

        await(broker.disconnect(7, new RecordingListener()));
        await(broker.disconnect(99, bob));

        assertEquals(Map.of(7L, 1), barrier());
    }

    @Test
    void nonMemberIsDenied() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.connect(MALLORY, 7, new RecordingListener())));

        ConversationAccessException cause = assertInstanceOf(ConversationAccessException.class, ex.getCause());
        assertEquals(ConversationAccessException.Reason.NOT_A_MEMBER, cause.reason());
        assertEquals(7, cause.conversation());
        assertEquals(MALLORY, cause.user());
    }

    @Test
    void unknownConversationIsDenied() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.connect(ALICE, 404, new RecordingListener())));

        ConversationAccessException cause = assertInstanceOf(ConversationAccessException.class, ex.getCause());
        assertEquals(ConversationAccessException.Reason.NOT_FOUND, cause.reason());
    }

    @Test
    void invalidBodyIsRejectedWithoutSideEffects() throws Exception {
        RecordingListener bob = new RecordingListener();
        await(broker.connect(BOB, 7, bob));
        byte[] textAtRoot = MessageBuilder.frame(0, MessageBuilder.frame(2, new byte[] { 'x' }));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.newMessage(7, ALICE, textAtRoot)));
        barrier();

        MessageValidationException cause = assertInstanceOf(MessageValidationException.class, ex.getCause());
        assertEquals(ValidationError.BAD_CHILD, cause.error());
        assertTrue(store.stored().isEmpty());
        assertTrue(bob.events.isEmpty());
        assertTrue(notices.isEmpty());
    }

    @Test
    void trailingBytesAreRejected() {
        byte[] body = new byte[HELLO.length + 1];
        System.arraycopy(HELLO, 0, body, 0, HELLO.length);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.newMessage(7, ALICE, body)));

        MessageValidationException cause = assertInstanceOf(MessageValidationException.class, ex.getCause());
        assertEquals(ValidationError.TRAILING_BYTES, cause.error());
        assertTrue(store.stored().isEmpty());
    }

    @Test
    void messageToConversationWithoutListenersIsPersisted() throws Exception {
        long id = await(broker.newMessage(8, BOB, HELLO));

        assertEquals(1, store.stored().size());
        assertEquals(id, store.stored().get(0).id());
        assertArrayEquals(HELLO, store.stored().get(0).body());
    }

    @Test
    void storeFailureFailsTheFuture() {
        MessageStoreException failure = new MessageStoreException("disk full");
        store.failPersistWith(failure);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.newMessage(7, ALICE, HELLO)));

        assertSame(failure, ex.getCause());
    }

    @Test
    void messageToUnknownConversationFails() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.newMessage(404, ALICE, HELLO)));

        assertInstanceOf(ConversationNotFoundException.class, ex.getCause());
    }

    @Test
    void refusingListenerIsDroppedAndReported() throws Exception {
        RecordingListener healthy = new RecordingListener();
        await(broker.connect(BOB, 7, healthy));
        await(broker.connect(CAROL, 7, event -> false));

        long id = await(broker.newMessage(7, ALICE, HELLO));

        assertEquals(Map.of(7L, 1), barrier());
        assertEquals(1, healthy.events.size());
        List<DeliveryFailureEvent> failures = sink.eventsOfType(DeliveryFailureEvent.class);
        assertEquals(1, failures.size());
        assertEquals(CAROL, failures.get(0).listenerUser());
        assertEquals(id, failures.get(0).eventId());
        assertNull(failures.get(0).cause());
    }

    @Test
    void throwingListenerDoesNotStopFanOut() throws Exception {
        RecordingListener healthy = new RecordingListener();
        await(broker.connect(CAROL, 7, event -> {
            throw new IllegalStateException("boom");
        }));
        await(broker.connect(BOB, 7, healthy));

        await(broker.newMessage(7, ALICE, HELLO));

        assertEquals(1, healthy.events.size());
        assertEquals(Map.of(7L, 1), barrier());
        assertInstanceOf(IllegalStateException.class,
                sink.eventsOfType(DeliveryFailureEvent.class).get(0).cause());
    }

    @Test
    void offlineMembersAreNotified() throws Exception {
        await(broker.connect(BOB, 7, new RecordingListener()));
        byte[] mentionsCarol = MessageBuilder.message().paragraph().mention(CAROL).build();

        long id = await(broker.newMessage(7, ALICE, mentionsCarol));
        barrier();

        // Alice wrote it, Bob is connected: only Carol is notified.
        assertEquals(1, notices.size());
        NewMessageNotice notice = notices.get(0);
        assertEquals(CAROL, notice.recipient());
        assertEquals(id, notice.event().id());
        assertTrue(notice.mentioned());
    }

    @Test
    void idleConversationNotifiesAllButAuthor() throws Exception {
        await(broker.newMessage(8, ALICE, HELLO));
        barrier();

        assertEquals(1, notices.size());
        assertEquals(BOB, notices.get(0).recipient());
        assertFalse(notices.get(0).mentioned());
    }

    @Test
    void membersAreLoadedOnceWhileConversationIsActive() throws Exception {
        await(broker.connect(BOB, 7, new RecordingListener()));
        await(broker.connect(CAROL, 7, new RecordingListener()));
        await(broker.newMessage(7, ALICE, HELLO));

        assertEquals(1, store.membersCalls());
    }

    @Test
    void stoppedBrokerFailsNewCommands() {
        broker.stop();

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> await(broker.newMessage(7, ALICE, HELLO)));

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertFalse(broker.isRunning());
    }

    @Test
    void stoppedBrokerFailsEveryCommandKind() {
        broker.stop();

        assertTrue(broker.connect(ALICE, 7, event -> true).isCompletedExceptionally());
        assertTrue(broker.disconnect(7, event -> true).isCompletedExceptionally());
        assertTrue(broker.snapshot().isCompletedExceptionally());
    }

    @Test
    void bodyIsCopiedOnSubmit() throws Exception {
        RecordingListener bob = new RecordingListener();
        await(broker.connect(BOB, 7, bob));
        byte[] body = HELLO.clone();

        CompletableFuture<Long> result = broker.newMessage(7, ALICE, body);
        body[0] = 0x05;
        await(result);

        assertArrayEquals(HELLO, bob.events.get(0).body());
    }

    private static final class RecordingListener implements ConversationListener {
        private final List<ConversationEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public boolean deliver(ConversationEvent event) {
            events.add(event);
            return true;
        }
    }
}

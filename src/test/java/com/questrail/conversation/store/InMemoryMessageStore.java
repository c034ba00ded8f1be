package com.questrail.conversation.store;

import com.questrail.conversation.api.ConversationNotFoundException;
import com.questrail.conversation.api.MessageStore;
import com.questrail.conversation.api.MessageStoreException;
import com.questrail.conversation.api.PersistedMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link MessageStore} for tests.
 *
 * Event ids are assigned from 1 upwards across all conversations. Timestamps
 * are fixed so tests can assert on them.
 */
public final class InMemoryMessageStore implements MessageStore {

    public static final Instant TIMESTAMP = Instant.parse("2024-03-01T12:00:00Z");

    private final Map<Long, Set<Long>> members = new HashMap<>();
    private final List<Stored> stored = new ArrayList<>();
    private long nextId = 1;
    private MessageStoreException persistFailure;
    private int membersCalls;

    public record Stored(long conversation, long user, long id, byte[] body) {}

    public synchronized InMemoryMessageStore withConversation(long conversation, Long... users) {
        members.put(conversation, Set.of(users));
        return this;
    }

    /**
     * Make every subsequent {@link #persist} fail with {@code failure}, or
     * succeed again for {@code null}.
     */
    public synchronized void failPersistWith(MessageStoreException failure) {
        this.persistFailure = failure;
    }

    @Override
    public synchronized PersistedMessage persist(long conversation, long user, byte[] body)
            throws MessageStoreException {
        if (persistFailure != null) {
            throw persistFailure;
        }
        if (!members.containsKey(conversation)) {
            throw new ConversationNotFoundException(conversation);
        }
        long id = nextId++;
        stored.add(new Stored(conversation, user, id, body.clone()));
        return new PersistedMessage(id, TIMESTAMP);
    }

    @Override
    public synchronized Set<Long> members(long conversation) throws MessageStoreException {
        membersCalls++;
        Set<Long> users = members.get(conversation);
        if (users == null) {
            throw new ConversationNotFoundException(conversation);
        }
        return users;
    }

    public synchronized List<Stored> stored() {
        return new ArrayList<>(stored);
    }

    public synchronized int membersCalls() {
        return membersCalls;
    }
}

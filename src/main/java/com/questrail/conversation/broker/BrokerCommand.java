package com.questrail.conversation.broker;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Commands queued for the broker thread. Each carries the future its
 * submitter is waiting on.
 */
sealed interface BrokerCommand<T>
{
    CompletableFuture<T> result();

    record Connect(long user,
                   long conversation,
                   ConversationListener listener,
                   CompletableFuture<Void> result) implements BrokerCommand<Void> {}

    record Disconnect(long conversation,
                      ConversationListener listener,
                      CompletableFuture<Void> result) implements BrokerCommand<Void> {}

    record NewMessage(long conversation,
                      long user,
                      byte[] body,
                      CompletableFuture<Long> result) implements BrokerCommand<Long> {}

    record Snapshot(CompletableFuture<Map<Long, Integer>> result) implements BrokerCommand<Map<Long, Integer>> {}
}

package io.survivalmesh.gossip;

import io.survivalmesh.model.GossipMessage;
import io.survivalmesh.model.Priority;

import java.util.Comparator;

/**
 * A message waiting in the send queue. {@code sequence} is the insertion order and breaks ties
 * between entries of the same priority; a retried entry keeps its original sequence.
 */
public record QueueEntry(
        GossipMessage message,
        Priority priority,
        int retryCount,
        long sequence
) {
    public static final Comparator<QueueEntry> SEND_ORDER = Comparator
            .comparingInt((QueueEntry e) -> e.priority().rank())
            .thenComparingLong(QueueEntry::sequence);

    public QueueEntry nextAttempt() {
        return new QueueEntry(message, priority, retryCount + 1, sequence);
    }
}

package io.survivalmesh.gossip;

/**
 * Point-in-time health snapshot of one engine. Counters are totals since construction.
 */
public record GossipStats(
        String nodeId,
        int queueLength,
        boolean inFlight,
        int localPostCount,
        int seenMessageCount,
        int peerCount,
        int connectedPeerCount,
        int pendingRetries,
        int partialMessages,
        long sentTotal,
        long failedAttemptsTotal,
        long droppedTotal,
        long duplicateTotal,
        long hopLimitedTotal,
        long invalidPostsTotal,
        int unresolvedFailures
) {
}

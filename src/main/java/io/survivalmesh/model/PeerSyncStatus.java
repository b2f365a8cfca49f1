package io.survivalmesh.model;

public record PeerSyncStatus(
        String peerId,
        long lastSyncTimeMs,
        long messageCount,
        boolean connected
) {
}

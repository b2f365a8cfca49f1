package io.survivalmesh.transport;

/**
 * Short-range radio seen from the gossip layer: discovery, connection events and bounded-size
 * payload delivery. Payloads larger than {@link #maxPayloadBytes()} are refused with
 * {@link TransportException}.
 */
public interface TransportAdapter {
    void startAdvertising(String displayName);

    void startDiscovery();

    void stopAll();

    void sendPayload(String peerId, String payload);

    void broadcastPayload(String payload);

    Subscription subscribe(TransportListener listener);

    int maxPayloadBytes();

    /**
     * Handle returned by {@link #subscribe}; closing it unregisters the listener.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}

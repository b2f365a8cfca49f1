package io.survivalmesh.transport;

/**
 * Events raised by a transport. Callbacks may arrive on any transport thread.
 */
public interface TransportListener {
    void onPayloadReceived(String peerId, String payload);

    default void onEndpointFound(String peerId, String name) {
    }

    default void onEndpointLost(String peerId) {
    }
}

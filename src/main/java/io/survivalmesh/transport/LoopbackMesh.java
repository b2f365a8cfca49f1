package io.survivalmesh.transport;

import io.survivalmesh.codec.PayloadCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process radio for simulations and tests. Endpoints only hear each other while linked
 * ("in range"); linking and unlinking raise found/lost events on both sides. Delivery is
 * asynchronous on a single thread, so payloads between two endpoints keep their order.
 */
public final class LoopbackMesh implements AutoCloseable {
    private final int radioLimitBytes;
    private final ExecutorService delivery;
    private final Map<String, Endpoint> endpoints;
    private final Map<String, Set<String>> links;
    private final AtomicLong deliveredTotal;

    public LoopbackMesh(int radioLimitBytes) {
        this.radioLimitBytes = radioLimitBytes;
        this.delivery = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "loopback-radio");
            t.setDaemon(true);
            return t;
        });
        this.endpoints = new LinkedHashMap<>();
        this.links = new LinkedHashMap<>();
        this.deliveredTotal = new AtomicLong(0L);
    }

    public synchronized Endpoint join(String peerId) {
        if (endpoints.containsKey(peerId)) {
            throw new IllegalArgumentException("Endpoint already joined: " + peerId);
        }
        Endpoint endpoint = new Endpoint(peerId);
        endpoints.put(peerId, endpoint);
        links.put(peerId, new LinkedHashSet<>());
        return endpoint;
    }

    public void link(String a, String b) {
        Endpoint ea;
        Endpoint eb;
        synchronized (this) {
            ea = require(a);
            eb = require(b);
            if (a.equals(b) || !links.get(a).add(b)) {
                return;
            }
            links.get(b).add(a);
        }
        announceFound(ea, eb);
        announceFound(eb, ea);
    }

    public void unlink(String a, String b) {
        Endpoint ea;
        Endpoint eb;
        synchronized (this) {
            ea = require(a);
            eb = require(b);
            if (!links.get(a).remove(b)) {
                return;
            }
            links.get(b).remove(a);
        }
        dispatch(() -> ea.fireLost(b));
        dispatch(() -> eb.fireLost(a));
    }

    public synchronized Set<String> neighbors(String peerId) {
        Set<String> out = links.get(peerId);
        return out == null ? Set.of() : Set.copyOf(out);
    }

    public long deliveredTotal() {
        return deliveredTotal.get();
    }

    @Override
    public void close() {
        delivery.shutdownNow();
    }

    private Endpoint require(String peerId) {
        Endpoint endpoint = endpoints.get(peerId);
        if (endpoint == null) {
            throw new IllegalArgumentException("Unknown endpoint: " + peerId);
        }
        return endpoint;
    }

    private void announceFound(Endpoint listener, Endpoint found) {
        if (listener.discovering && found.advertising) {
            dispatch(() -> listener.fireFound(found.peerId, found.displayName));
        }
    }

    private void deliver(Endpoint from, String toPeerId, String payload) {
        Endpoint target;
        synchronized (this) {
            target = endpoints.get(toPeerId);
        }
        if (target == null) {
            return;
        }
        dispatch(() -> {
            deliveredTotal.incrementAndGet();
            target.firePayload(from.peerId, payload);
        });
    }

    private void dispatch(Runnable task) {
        try {
            delivery.execute(task);
        } catch (RejectedExecutionException e) {
            throw new TransportException("Loopback radio is closed", e);
        }
    }

    public final class Endpoint implements TransportAdapter {
        private final String peerId;
        private final List<TransportListener> listeners;
        private final AtomicLong sendAttempts;
        private volatile String displayName;
        private volatile boolean advertising;
        private volatile boolean discovering;
        private volatile boolean failing;

        private Endpoint(String peerId) {
            this.peerId = peerId;
            this.listeners = new CopyOnWriteArrayList<>();
            this.sendAttempts = new AtomicLong(0L);
            this.displayName = peerId;
        }

        public String peerId() {
            return peerId;
        }

        /**
         * Makes every following send fail, as a radio with a dead link would.
         */
        public void setFailing(boolean failing) {
            this.failing = failing;
        }

        public long sendAttempts() {
            return sendAttempts.get();
        }

        public int listenerCount() {
            return listeners.size();
        }

        @Override
        public void startAdvertising(String name) {
            this.displayName = name == null || name.isBlank() ? peerId : name;
            this.advertising = true;
        }

        @Override
        public void startDiscovery() {
            this.discovering = true;
            for (String neighbor : neighbors(peerId)) {
                Endpoint other;
                synchronized (LoopbackMesh.this) {
                    other = endpoints.get(neighbor);
                }
                if (other != null) {
                    announceFound(this, other);
                    announceFound(other, this);
                }
            }
        }

        @Override
        public void stopAll() {
            advertising = false;
            discovering = false;
        }

        @Override
        public void sendPayload(String targetPeerId, String payload) {
            checkSendable(payload);
            if (!neighbors(peerId).contains(targetPeerId)) {
                throw new TransportException("Peer not connected: " + targetPeerId);
            }
            deliver(this, targetPeerId, payload);
        }

        @Override
        public void broadcastPayload(String payload) {
            checkSendable(payload);
            List<String> targets = new ArrayList<>(neighbors(peerId));
            for (String target : targets) {
                deliver(this, target, payload);
            }
        }

        @Override
        public Subscription subscribe(TransportListener listener) {
            listeners.add(listener);
            return () -> listeners.remove(listener);
        }

        @Override
        public int maxPayloadBytes() {
            return radioLimitBytes;
        }

        private void checkSendable(String payload) {
            sendAttempts.incrementAndGet();
            if (failing) {
                throw new TransportException("Radio link failure on " + peerId);
            }
            if (!advertising && !discovering) {
                throw new TransportException("Endpoint not started: " + peerId);
            }
            int size = PayloadCodec.size(payload);
            if (size > radioLimitBytes) {
                throw new TransportException("Payload of " + size + " bytes exceeds radio limit " + radioLimitBytes);
            }
        }

        private void firePayload(String fromPeerId, String payload) {
            for (TransportListener listener : listeners) {
                listener.onPayloadReceived(fromPeerId, payload);
            }
        }

        private void fireFound(String foundPeerId, String name) {
            for (TransportListener listener : listeners) {
                listener.onEndpointFound(foundPeerId, name);
            }
        }

        private void fireLost(String lostPeerId) {
            for (TransportListener listener : listeners) {
                listener.onEndpointLost(lostPeerId);
            }
        }
    }
}

package io.survivalmesh.transport;

import io.survivalmesh.codec.PayloadCodec;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Datagram transport for running mesh nodes on a LAN. Peers are the configured seed endpoints;
 * a peer counts as found once a datagram arrives from it and as lost after
 * {@code peerTimeoutMs} of silence. Advertising sends a small hello to every seed on a fixed
 * interval so idle peers stay visible.
 */
public final class UdpTransport implements TransportAdapter {
    static final String HELLO_PREFIX = "SMHELLO:";
    private static final int RECEIVE_POLL_MS = 250;

    private final int bindPort;
    private final List<SeedEndpoint> seeds;
    private final int maxPayloadBytes;
    private final long announceIntervalMs;
    private final long peerTimeoutMs;
    private final List<TransportListener> listeners;
    private final Map<String, Long> lastSeenMs;
    private final Set<String> livePeers;
    private final Object lifecycleLock;
    private volatile String displayName;
    private volatile boolean running;
    private DatagramSocket socket;
    private Thread receiver;
    private ScheduledExecutorService timers;

    public UdpTransport(int bindPort, List<String> seedEndpoints, int maxPayloadBytes, long announceIntervalMs, long peerTimeoutMs) {
        if (bindPort <= 0 || bindPort > 65535) {
            throw new IllegalArgumentException("Invalid UDP port: " + bindPort);
        }
        this.bindPort = bindPort;
        this.seeds = parseSeedEndpoints(seedEndpoints);
        this.maxPayloadBytes = maxPayloadBytes;
        this.announceIntervalMs = Math.max(100L, announceIntervalMs);
        this.peerTimeoutMs = Math.max(this.announceIntervalMs * 2L, peerTimeoutMs);
        this.listeners = new CopyOnWriteArrayList<>();
        this.lastSeenMs = new ConcurrentHashMap<>();
        this.livePeers = ConcurrentHashMap.newKeySet();
        this.lifecycleLock = new Object();
        this.displayName = "node-" + bindPort;
    }

    @Override
    public void startAdvertising(String name) {
        if (name != null && !name.isBlank()) {
            this.displayName = name.trim();
        }
        ensureStarted();
        timers.scheduleWithFixedDelay(this::announce, 0L, announceIntervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void startDiscovery() {
        ensureStarted();
        long sweepEvery = Math.max(100L, peerTimeoutMs / 2L);
        timers.scheduleWithFixedDelay(this::sweepSilentPeers, sweepEvery, sweepEvery, TimeUnit.MILLISECONDS);
    }

    @Override
    public void stopAll() {
        Thread receiverThread;
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            timers.shutdownNow();
            socket.close();
            receiverThread = receiver;
        }
        try {
            receiverThread.join(RECEIVE_POLL_MS * 4L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        livePeers.clear();
    }

    @Override
    public void sendPayload(String peerId, String payload) {
        checkSize(payload);
        SeedEndpoint target = parseEndpoint(peerId);
        if (target == null) {
            throw new TransportException("Invalid peer endpoint: " + peerId);
        }
        send(target, payload.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void broadcastPayload(String payload) {
        checkSize(payload);
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        int sent = 0;
        TransportException last = null;
        for (SeedEndpoint seed : seeds) {
            try {
                send(seed, bytes);
                sent++;
            } catch (TransportException e) {
                last = e;
            }
        }
        if (sent == 0 && last != null) {
            throw last;
        }
    }

    @Override
    public Subscription subscribe(TransportListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public int maxPayloadBytes() {
        return maxPayloadBytes;
    }

    public Set<String> livePeers() {
        return Set.copyOf(livePeers);
    }

    private void ensureStarted() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            try {
                DatagramSocket s = new DatagramSocket(null);
                s.setReuseAddress(true);
                s.bind(new InetSocketAddress(bindPort));
                s.setSoTimeout(RECEIVE_POLL_MS);
                socket = s;
            } catch (IOException e) {
                throw new TransportException("Failed to bind UDP port " + bindPort, e);
            }
            timers = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "udp-transport-timers-" + bindPort);
                t.setDaemon(true);
                return t;
            });
            running = true;
            receiver = new Thread(this::receiveLoop, "udp-transport-receiver-" + bindPort);
            receiver.setDaemon(true);
            receiver.start();
        }
    }

    private void receiveLoop() {
        byte[] buf = new byte[Math.max(2048, maxPayloadBytes * 4)];
        while (running) {
            DatagramPacket incoming = new DatagramPacket(buf, buf.length);
            try {
                socket.receive(incoming);
            } catch (SocketTimeoutException timeout) {
                continue;
            } catch (SocketException closed) {
                break;
            } catch (IOException e) {
                continue;
            }
            String peerId = incoming.getAddress().getHostAddress() + ":" + incoming.getPort();
            String body = new String(incoming.getData(), incoming.getOffset(), incoming.getLength(), StandardCharsets.UTF_8);
            if (body.startsWith(HELLO_PREFIX)) {
                markSeen(peerId, body.substring(HELLO_PREFIX.length()));
                continue;
            }
            markSeen(peerId, null);
            for (TransportListener listener : listeners) {
                listener.onPayloadReceived(peerId, body);
            }
        }
    }

    private void markSeen(String peerId, String name) {
        lastSeenMs.put(peerId, System.currentTimeMillis());
        if (livePeers.add(peerId)) {
            String resolvedName = name == null || name.isBlank() ? peerId : name;
            for (TransportListener listener : listeners) {
                listener.onEndpointFound(peerId, resolvedName);
            }
        }
    }

    private void sweepSilentPeers() {
        long now = System.currentTimeMillis();
        for (String peerId : new ArrayList<>(livePeers)) {
            Long seen = lastSeenMs.get(peerId);
            if (seen == null || now - seen > peerTimeoutMs) {
                if (livePeers.remove(peerId)) {
                    for (TransportListener listener : listeners) {
                        listener.onEndpointLost(peerId);
                    }
                }
            }
        }
    }

    private void announce() {
        byte[] hello = (HELLO_PREFIX + displayName).getBytes(StandardCharsets.UTF_8);
        for (SeedEndpoint seed : seeds) {
            try {
                send(seed, hello);
            } catch (TransportException ignored) {
                // Unreachable seeds are expected while the mesh is partitioned.
            }
        }
    }

    private void send(SeedEndpoint target, byte[] bytes) {
        DatagramSocket s = socket;
        if (!running || s == null) {
            throw new TransportException("UDP transport not started");
        }
        try {
            DatagramPacket packet = new DatagramPacket(bytes, bytes.length, InetAddress.getByName(target.host()), target.port());
            s.send(packet);
        } catch (IOException e) {
            throw new TransportException("Failed to send datagram to " + target.host() + ":" + target.port(), e);
        }
    }

    private void checkSize(String payload) {
        int size = PayloadCodec.size(payload);
        if (size > maxPayloadBytes) {
            throw new TransportException("Payload of " + size + " bytes exceeds radio limit " + maxPayloadBytes);
        }
    }

    static List<SeedEndpoint> parseSeedEndpoints(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<SeedEndpoint> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String value : raw) {
            SeedEndpoint endpoint = parseEndpoint(value);
            if (endpoint == null) {
                continue;
            }
            String dedupKey = endpoint.host().toLowerCase(Locale.ROOT) + ":" + endpoint.port();
            if (seen.add(dedupKey)) {
                out.add(endpoint);
            }
        }
        return out;
    }

    static SeedEndpoint parseEndpoint(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        int idx = trimmed.lastIndexOf(':');
        if (idx <= 0 || idx == trimmed.length() - 1) {
            return null;
        }
        try {
            int port = Integer.parseInt(trimmed.substring(idx + 1));
            if (port <= 0 || port > 65535) {
                return null;
            }
            return new SeedEndpoint(trimmed.substring(0, idx), port);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    record SeedEndpoint(String host, int port) {
    }
}

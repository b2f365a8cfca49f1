package io.survivalmesh.gossip;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.survivalmesh.chunk.ChunkReassembler;
import io.survivalmesh.chunk.ChunkingException;
import io.survivalmesh.chunk.MessageChunk;
import io.survivalmesh.chunk.MessageChunker;
import io.survivalmesh.codec.CorruptPayloadException;
import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.GossipSettings;
import io.survivalmesh.config.SurvivalMeshConfig;
import io.survivalmesh.model.ComingAck;
import io.survivalmesh.model.GossipMessage;
import io.survivalmesh.model.MessageType;
import io.survivalmesh.model.PeerSyncStatus;
import io.survivalmesh.model.PostKind;
import io.survivalmesh.model.Priority;
import io.survivalmesh.model.SurvivalPost;
import io.survivalmesh.observability.MeshEventLog;
import io.survivalmesh.transport.TransportAdapter;
import io.survivalmesh.transport.TransportException;
import io.survivalmesh.transport.TransportListener;
import io.survivalmesh.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Flood-gossip engine of one node.
 *
 * <p>All state (local posts, seen messages, peer status, send queue) is owned by a single actor
 * thread. Public operations marshal onto it and block until it has run them; transport events
 * are queued onto it without blocking the transport thread. Sends run on a separate sender
 * thread so a slow radio never stalls inbound handling, and every completion is handed back to
 * the actor before the next entry is drained.
 *
 * <p>Failure handling never escapes to the caller or to transport threads: malformed input is
 * dropped with an event, transport failures are retried along the backoff sequence and then
 * dropped, and frames that cannot fit the radio limit are dropped as capacity failures.
 */
public final class GossipEngine implements AutoCloseable {
    private static final long CLOSE_WAIT_MS = 5_000L;

    private final String nodeId;
    private final String displayName;
    private final GossipSettings settings;
    private final TransportAdapter transport;
    private final MeshEventLog eventLog;
    private final PostValidator validator;
    private final ChunkReassembler reassembler;
    private final ScheduledThreadPoolExecutor actor;
    private final ExecutorService sender;
    private volatile Thread actorThread;

    private final Map<String, SurvivalPost> localPosts;
    private final Set<String> seenMessages;
    private final Map<String, PeerSyncStatus> peers;
    private final Map<String, Boolean> linkState;
    private final PriorityQueue<QueueEntry> queue;
    private final Map<Long, ScheduledFuture<?>> pendingRetries;

    private final AtomicLong sentTotal;
    private final AtomicLong failedAttemptsTotal;
    private final AtomicLong droppedTotal;
    private final AtomicLong duplicateTotal;
    private final AtomicLong hopLimitedTotal;
    private final AtomicLong invalidPostsTotal;

    private TransportAdapter.Subscription subscription;
    private ScheduledFuture<?> drainTask;
    private boolean started;
    private boolean inFlight;
    private long sequence;
    private long retrySequence;
    private long lastTimestampMs;
    private long nextSendAllowedMs;
    private volatile boolean closed;

    public GossipEngine(String nodeId, GossipSettings settings, TransportAdapter transport, MeshEventLog eventLog) {
        this(nodeId, SurvivalMeshConfig.DEFAULT_DISPLAY_NAME, settings, transport, eventLog);
    }

    public GossipEngine(
            String nodeId,
            String displayName,
            GossipSettings settings,
            TransportAdapter transport,
            MeshEventLog eventLog
    ) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        this.nodeId = nodeId.trim();
        this.displayName = displayName == null || displayName.isBlank() ? this.nodeId : displayName.trim();
        this.settings = settings;
        this.transport = transport;
        this.eventLog = eventLog;
        this.validator = new PostValidator(settings);
        this.reassembler = new ChunkReassembler(
                settings.reassemblyTimeoutMs(),
                settings.reassemblySweepIntervalMs(),
                System::currentTimeMillis,
                this::onReassemblyTimeout
        );
        this.actor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "gossip-" + this.nodeId);
            t.setDaemon(true);
            actorThread = t;
            return t;
        });
        this.actor.setRemoveOnCancelPolicy(true);
        this.actor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.sender = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gossip-send-" + this.nodeId);
            t.setDaemon(true);
            return t;
        });
        this.localPosts = new LinkedHashMap<>();
        this.seenMessages = new HashSet<>();
        this.peers = new LinkedHashMap<>();
        this.linkState = new LinkedHashMap<>();
        this.queue = new PriorityQueue<>(QueueEntry.SEND_ORDER);
        this.pendingRetries = new LinkedHashMap<>();
        this.sentTotal = new AtomicLong(0L);
        this.failedAttemptsTotal = new AtomicLong(0L);
        this.droppedTotal = new AtomicLong(0L);
        this.duplicateTotal = new AtomicLong(0L);
        this.hopLimitedTotal = new AtomicLong(0L);
        this.invalidPostsTotal = new AtomicLong(0L);
    }

    public String nodeId() {
        return nodeId;
    }

    public GossipSettings settings() {
        return settings;
    }

    /**
     * Subscribes to the transport, starts advertising and discovery, and begins draining the
     * send queue. Entries enqueued before start are kept and sent once draining begins.
     */
    public void start() {
        onActor(() -> {
            ensureOpen();
            if (started) {
                return null;
            }
            subscription = transport.subscribe(new EngineListener());
            reassembler.start();
            transport.startAdvertising(displayName);
            transport.startDiscovery();
            started = true;
            log(MeshEventLog.MeshEvent.info("engine.start", "ok", null, Map.of(
                    "display_name", displayName,
                    "queued", queue.size()
            )));
            scheduleDrain(0L);
            return null;
        });
    }

    /**
     * Stores a locally created post and enqueues it as a single-post update at its own priority.
     *
     * @throws IllegalArgumentException if the post is structurally invalid
     */
    public void addLocalPost(SurvivalPost post) {
        String problem = validator.problem(post);
        if (problem != null) {
            throw new IllegalArgumentException("Invalid post: " + problem);
        }
        onActor(() -> {
            ensureOpen();
            localPosts.put(post.id(), post);
            enqueue(GossipMessage.ofPosts(MessageType.POST_UPDATE, List.of(post), nodeId, nextTimestamp()), post.priority());
            log(MeshEventLog.MeshEvent.info("post.add", "ok", null, postDetails(post)));
            return null;
        });
    }

    public boolean removeLocalPost(String postId) {
        return onActor(() -> {
            ensureOpen();
            SurvivalPost removed = localPosts.remove(postId);
            if (removed == null) {
                return false;
            }
            log(MeshEventLog.MeshEvent.info("post.remove", "ok", null, postDetails(removed)));
            return true;
        });
    }

    /**
     * Replaces a known post with {@code updater}'s result and floods the new version.
     *
     * @return the stored post, or empty if no post has that id
     * @throws IllegalArgumentException if the updated post is invalid or changes the id
     */
    public Optional<SurvivalPost> updateLocalPost(String postId, UnaryOperator<SurvivalPost> updater) {
        return onActor(() -> {
            ensureOpen();
            SurvivalPost current = localPosts.get(postId);
            if (current == null) {
                return Optional.empty();
            }
            SurvivalPost updated = updater.apply(current);
            if (updated == null || !postId.equals(updated.id())) {
                throw new IllegalArgumentException("Update must keep post id " + postId);
            }
            String problem = validator.problem(updated);
            if (problem != null) {
                throw new IllegalArgumentException("Invalid post: " + problem);
            }
            localPosts.put(postId, updated);
            enqueue(GossipMessage.ofPosts(MessageType.POST_UPDATE, List.of(updated), nodeId, nextTimestamp()), updated.priority());
            log(MeshEventLog.MeshEvent.info("post.update", "ok", null, postDetails(updated)));
            return Optional.of(updated);
        });
    }

    /**
     * Marks an SOS post resolved and floods the change.
     *
     * @throws IllegalArgumentException if the post is not an SOS post
     */
    public Optional<SurvivalPost> resolveSos(String postId) {
        return updateLocalPost(postId, post -> {
            if (post.kind() != PostKind.SOS) {
                throw new IllegalArgumentException("Post " + postId + " is not an SOS post");
            }
            return post.withResolved(true);
        });
    }

    /**
     * Enqueues every known post as one batch, placed by its most urgent post.
     *
     * @return false if there was nothing to send
     */
    public boolean broadcastLocalPosts() {
        return onActor(() -> {
            ensureOpen();
            return enqueueLocalPosts("broadcast");
        });
    }

    /**
     * Resyncs after a previously lost peer is reachable again by flooding the whole local set.
     */
    public boolean handlePartitionHeal(String peerId) {
        return onActor(() -> {
            ensureOpen();
            log(MeshEventLog.MeshEvent.info("peer.heal", "ok", peerId, Map.of("local_posts", localPosts.size())));
            return enqueueLocalPosts("partition_heal");
        });
    }

    /**
     * Applies a received message and returns exactly the posts that were new to this node.
     */
    public List<SurvivalPost> receiveMessage(GossipMessage message, String fromPeer) {
        return onActor(() -> {
            if (closed) {
                return List.of();
            }
            return receiveOnActor(message, fromPeer);
        });
    }

    /**
     * Tells the mesh that {@code houseNumber} is on the way to {@code postId}. The responder is
     * added to the local copy of the post when it is known here.
     */
    public void sendComingAck(String postId, String houseNumber) {
        ComingAck ack = new ComingAck(postId, houseNumber);
        if (validator.parseAck(Jsons.compact().valueToTree(ack)).isEmpty()) {
            throw new IllegalArgumentException("Invalid ack for post " + postId);
        }
        onActor(() -> {
            ensureOpen();
            SurvivalPost post = localPosts.get(postId);
            if (post != null) {
                localPosts.put(postId, post.withResponder(houseNumber));
            }
            enqueue(GossipMessage.ofAck(ack, nodeId, nextTimestamp()), Priority.ACK);
            log(MeshEventLog.MeshEvent.info("ack.send", "ok", null, Map.of(
                    "post_id", postId,
                    "house", houseNumber
            )));
            return null;
        });
    }

    public List<SurvivalPost> getLocalPosts() {
        return onActor(() -> List.copyOf(localPosts.values()));
    }

    public Map<String, PeerSyncStatus> getPeerSyncStatus() {
        return onActor(() -> Collections.unmodifiableMap(new LinkedHashMap<>(peers)));
    }

    /**
     * Queued entries in the order they will be sent.
     */
    public List<QueueEntry> pendingEntries() {
        return onActor(() -> {
            List<QueueEntry> out = new ArrayList<>(queue);
            out.sort(QueueEntry.SEND_ORDER);
            return out;
        });
    }

    public GossipStats getQueueStats() {
        return onActor(() -> {
            int connected = 0;
            for (PeerSyncStatus status : peers.values()) {
                if (status.connected()) {
                    connected++;
                }
            }
            return new GossipStats(
                    nodeId,
                    queue.size(),
                    inFlight,
                    localPosts.size(),
                    seenMessages.size(),
                    peers.size(),
                    connected,
                    pendingRetries.size(),
                    reassembler.partialMessageCount(),
                    sentTotal.get(),
                    failedAttemptsTotal.get(),
                    droppedTotal.get(),
                    duplicateTotal.get(),
                    hopLimitedTotal.get(),
                    invalidPostsTotal.get(),
                    eventLog.unresolvedFailureCount()
            );
        });
    }

    public void clearSeenMessages() {
        onActor(() -> {
            int cleared = seenMessages.size();
            seenMessages.clear();
            log(MeshEventLog.MeshEvent.info("seen.clear", "ok", null, Map.of("cleared", cleared)));
            return null;
        });
    }

    /**
     * Stops timers and transport activity. A send already handed to the radio is waited for and
     * its completion is recorded before the actor stops. Safe to call more than once.
     */
    @Override
    public void close() {
        int cancelled = onActor(() -> {
            if (closed) {
                return -1;
            }
            closed = true;
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
            if (drainTask != null) {
                drainTask.cancel(false);
                drainTask = null;
            }
            int count = pendingRetries.size();
            for (ScheduledFuture<?> retry : pendingRetries.values()) {
                retry.cancel(false);
            }
            pendingRetries.clear();
            return count;
        });
        if (cancelled < 0) {
            return;
        }
        sender.shutdown();
        awaitQuietly(sender);
        actor.shutdown();
        awaitQuietly(actor);
        reassembler.close();
        try {
            transport.stopAll();
        } catch (TransportException e) {
            log(MeshEventLog.MeshEvent.warn("engine.close", "transport_stop_failed", null, Map.of(
                    "error", String.valueOf(e.getMessage())
            )));
        }
        log(MeshEventLog.MeshEvent.info("engine.close", "ok", null, Map.of(
                "cancelled_retries", cancelled,
                "queued_unsent", queue.size()
        )));
    }

    private List<SurvivalPost> receiveOnActor(GossipMessage message, String fromPeer) {
        if (message == null || message.type() == null || message.payload() == null || message.payload().isNull()
                || message.senderId() == null || message.senderId().isBlank() || message.hopCount() < 0) {
            invalidPostsTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.warn("message.receive", "malformed", fromPeer, Map.of()));
            return List.of();
        }
        if (message.hopCount() >= settings.maxHops()) {
            hopLimitedTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.info("message.receive", "hop_limited", fromPeer, Map.of(
                    "hop_count", message.hopCount(),
                    "sender", message.senderId()
            )));
            return List.of();
        }
        String identity = message.identity();
        if (seenMessages.contains(identity)) {
            duplicateTotal.incrementAndGet();
            return List.of();
        }
        if (seenMessages.size() >= settings.seenMessageLimit()) {
            log(MeshEventLog.MeshEvent.info("seen.clear", "limit", null, Map.of("cleared", seenMessages.size())));
            seenMessages.clear();
        }
        seenMessages.add(identity);
        touchPeer(fromPeer);

        if (message.type() == MessageType.ACK) {
            receiveAck(message, fromPeer);
            return List.of();
        }

        List<SurvivalPost> added = new ArrayList<>();
        int updated = 0;
        int invalid = 0;
        Priority relayPriority = null;
        List<JsonNode> entries = new ArrayList<>();
        if (message.payload().isArray()) {
            message.payload().forEach(entries::add);
        } else {
            entries.add(message.payload());
        }
        for (JsonNode node : entries) {
            Optional<SurvivalPost> parsed = validator.parse(node);
            if (parsed.isEmpty()) {
                invalid++;
                continue;
            }
            SurvivalPost post = parsed.get();
            SurvivalPost known = localPosts.get(post.id());
            if (known == null) {
                localPosts.put(post.id(), post);
                added.add(post);
            } else if (message.type() == MessageType.POST_UPDATE && !known.equals(post)) {
                // Updates are taken as-is; concurrent conflicting edits are bounded by the hop limit.
                localPosts.put(post.id(), post);
                updated++;
            } else {
                continue;
            }
            if (relayPriority == null || post.priority().rank() < relayPriority.rank()) {
                relayPriority = post.priority();
            }
        }
        if (invalid > 0) {
            invalidPostsTotal.addAndGet(invalid);
        }
        boolean relayed = relayPriority != null;
        if (relayed) {
            enqueue(message.relayed(nodeId), relayPriority);
        }
        log(MeshEventLog.MeshEvent.info("message.receive", "accepted", fromPeer, Map.of(
                "type", message.type().wireName(),
                "hop_count", message.hopCount(),
                "new_posts", added.size(),
                "updated_posts", updated,
                "invalid_posts", invalid,
                "relayed", relayed
        )));
        return added;
    }

    private void receiveAck(GossipMessage message, String fromPeer) {
        Optional<ComingAck> parsed = validator.parseAck(message.payload());
        if (parsed.isEmpty()) {
            invalidPostsTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.warn("ack.receive", "invalid", fromPeer, Map.of()));
            return;
        }
        ComingAck ack = parsed.get();
        SurvivalPost post = localPosts.get(ack.postId());
        if (post == null || post.hasResponder(ack.houseNumber())) {
            return;
        }
        localPosts.put(post.id(), post.withResponder(ack.houseNumber()));
        enqueue(message.relayed(nodeId), Priority.ACK);
        log(MeshEventLog.MeshEvent.info("ack.receive", "applied", fromPeer, Map.of(
                "post_id", ack.postId(),
                "house", ack.houseNumber()
        )));
    }

    private boolean enqueueLocalPosts(String reason) {
        if (localPosts.isEmpty()) {
            return false;
        }
        List<SurvivalPost> posts = new ArrayList<>(localPosts.values());
        posts.sort((a, b) -> Integer.compare(a.priority().rank(), b.priority().rank()));
        Priority priority = posts.get(0).priority();
        enqueue(GossipMessage.ofPosts(MessageType.POST_LIST, posts, nodeId, nextTimestamp()), priority);
        log(MeshEventLog.MeshEvent.info("posts.broadcast", reason, null, Map.of(
                "posts", posts.size(),
                "priority", priority.name()
        )));
        return true;
    }

    private void enqueue(GossipMessage message, Priority priority) {
        queue.add(new QueueEntry(message, priority, 0, sequence++));
        scheduleDrain(0L);
    }

    private void scheduleDrain(long delayMs) {
        if (closed || !started || inFlight || drainTask != null || queue.isEmpty()) {
            return;
        }
        long gapMs = nextSendAllowedMs - System.currentTimeMillis();
        drainTask = actor.schedule(this::drainOnce, Math.max(delayMs, gapMs), TimeUnit.MILLISECONDS);
    }

    private void drainOnce() {
        drainTask = null;
        if (closed || inFlight) {
            return;
        }
        QueueEntry entry = queue.poll();
        if (entry == null) {
            return;
        }
        inFlight = true;
        sender.execute(() -> {
            SendOutcome outcome = transmit(entry);
            actor.execute(() -> completeSend(entry, outcome));
        });
    }

    private SendOutcome transmit(QueueEntry entry) {
        try {
            String body = Jsons.toCompactJson(entry.message());
            int limit = effectivePayloadLimit();
            if (PayloadCodec.size(body) <= limit) {
                transport.broadcastPayload(body);
                return SendOutcome.ok(1);
            }
            String compressed = PayloadCodec.compress(body);
            String content = PayloadCodec.size(compressed) < PayloadCodec.size(body) ? compressed : body;
            List<MessageChunk> chunks = MessageChunker.split(content, limit, settings.chunkOverheadBytes());
            for (MessageChunk chunk : chunks) {
                transport.broadcastPayload(Jsons.toCompactJson(chunk));
            }
            return SendOutcome.ok(chunks.size());
        } catch (ChunkingException e) {
            return SendOutcome.capacity(e);
        } catch (RuntimeException e) {
            return SendOutcome.failed(e);
        }
    }

    private void completeSend(QueueEntry entry, SendOutcome outcome) {
        inFlight = false;
        nextSendAllowedMs = System.currentTimeMillis() + settings.interSendDelayMs();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", entry.message().type().wireName());
        details.put("priority", entry.priority().name());
        details.put("attempt", entry.retryCount() + 1);
        if (outcome.failure() == null) {
            sentTotal.incrementAndGet();
            details.put("frames", outcome.frames());
            log(MeshEventLog.MeshEvent.info("send", "ok", null, details));
        } else if (outcome.capacity()) {
            droppedTotal.incrementAndGet();
            details.put("error", String.valueOf(outcome.failure().getMessage()));
            log(MeshEventLog.MeshEvent.error("send.capacity", "dropped", null, details));
        } else {
            failedAttemptsTotal.incrementAndGet();
            details.put("error", String.valueOf(outcome.failure().getMessage()));
            List<Long> backoff = settings.retryBackoffMs();
            if (!closed && entry.retryCount() < backoff.size()) {
                long delayMs = backoff.get(entry.retryCount());
                details.put("retry_in_ms", delayMs);
                scheduleRetry(entry.nextAttempt(), delayMs);
                log(MeshEventLog.MeshEvent.info("send", "retry_scheduled", null, details));
            } else {
                droppedTotal.incrementAndGet();
                log(MeshEventLog.MeshEvent.warn("send", closed ? "dropped_on_close" : "dropped", null, details));
            }
        }
        scheduleDrain(settings.interSendDelayMs());
    }

    private void scheduleRetry(QueueEntry next, long delayMs) {
        long retryId = ++retrySequence;
        ScheduledFuture<?> future = actor.schedule(() -> {
            pendingRetries.remove(retryId);
            if (closed) {
                return;
            }
            queue.add(next);
            scheduleDrain(0L);
        }, delayMs, TimeUnit.MILLISECONDS);
        pendingRetries.put(retryId, future);
    }

    private void handlePayload(String fromPeer, String payload) {
        if (closed) {
            return;
        }
        JsonNode tree = parseJson(fromPeer, payload);
        if (tree == null) {
            return;
        }
        if (tree.has("messageId") && tree.has("chunkIndex")) {
            String body = acceptChunk(fromPeer, tree);
            if (body == null) {
                return;
            }
            if (!body.startsWith("{")) {
                try {
                    body = PayloadCodec.decompress(body);
                } catch (CorruptPayloadException e) {
                    log(MeshEventLog.MeshEvent.warn("chunk.decompress", "dropped", fromPeer, Map.of(
                            "error", String.valueOf(e.getMessage())
                    )));
                    return;
                }
            }
            tree = parseJson(fromPeer, body);
            if (tree == null) {
                return;
            }
        }
        receiveOnActor(toMessage(tree), fromPeer);
    }

    private String acceptChunk(String fromPeer, JsonNode tree) {
        MessageChunk chunk;
        try {
            chunk = Jsons.compact().treeToValue(tree, MessageChunk.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            invalidPostsTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.warn("chunk.receive", "malformed", fromPeer, Map.of()));
            return null;
        }
        if (chunk.messageId() == null || chunk.totalChunks() <= 0 || chunk.chunkIndex() < 0
                || chunk.chunkIndex() >= chunk.totalChunks()) {
            invalidPostsTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.warn("chunk.receive", "malformed", fromPeer, Map.of()));
            return null;
        }
        try {
            return reassembler.addChunk(chunk);
        } catch (ChunkingException e) {
            log(MeshEventLog.MeshEvent.warn("chunk.reassemble", e.reason().integrity() ? "integrity" : "rejected", fromPeer, Map.of(
                    "message_id", chunk.messageId(),
                    "reason", e.reason().name()
            )));
            return null;
        }
    }

    private JsonNode parseJson(String fromPeer, String payload) {
        try {
            JsonNode tree = Jsons.readTree(payload);
            if (tree == null || !tree.isObject()) {
                throw new IllegalArgumentException("Payload is not a JSON object");
            }
            return tree;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            invalidPostsTotal.incrementAndGet();
            log(MeshEventLog.MeshEvent.warn("payload.receive", "malformed", fromPeer, Map.of(
                    "bytes", payload == null ? 0 : PayloadCodec.size(payload)
            )));
            return null;
        }
    }

    private static GossipMessage toMessage(JsonNode tree) {
        JsonNode type = tree.get("type");
        JsonNode hopCount = tree.get("hopCount");
        JsonNode timestamp = tree.get("timestamp");
        JsonNode senderId = tree.get("senderId");
        if (type == null || !type.isTextual() || hopCount == null || !hopCount.isIntegralNumber()
                || !hopCount.canConvertToInt() || hopCount.asInt() < 0
                || timestamp == null || !timestamp.isIntegralNumber() || senderId == null || !senderId.isTextual()) {
            return null;
        }
        MessageType messageType;
        try {
            messageType = MessageType.fromWire(type.asText());
        } catch (IllegalArgumentException e) {
            return null;
        }
        return new GossipMessage(messageType, tree.get("payload"), hopCount.asInt(), timestamp.asLong(), senderId.asText());
    }

    private void handleEndpointFound(String peerId, String name) {
        if (closed) {
            return;
        }
        Boolean previous = linkState.put(peerId, true);
        PeerSyncStatus status = peers.get(peerId);
        peers.put(peerId, status == null
                ? new PeerSyncStatus(peerId, 0L, 0L, true)
                : new PeerSyncStatus(peerId, status.lastSyncTimeMs(), status.messageCount(), true));
        log(MeshEventLog.MeshEvent.info("peer.found", previous == null ? "new" : "reconnected", peerId, Map.of(
                "name", name == null ? "" : name
        )));
        if (Boolean.FALSE.equals(previous)) {
            log(MeshEventLog.MeshEvent.info("peer.heal", "ok", peerId, Map.of("local_posts", localPosts.size())));
            enqueueLocalPosts("partition_heal");
        } else if (previous == null && settings.syncOnDiscovery()) {
            enqueueLocalPosts("discovery");
        }
    }

    private void handleEndpointLost(String peerId) {
        if (closed) {
            return;
        }
        linkState.put(peerId, false);
        PeerSyncStatus status = peers.get(peerId);
        if (status != null) {
            peers.put(peerId, new PeerSyncStatus(peerId, status.lastSyncTimeMs(), status.messageCount(), false));
        }
        log(MeshEventLog.MeshEvent.info("peer.lost", "ok", peerId, Map.of()));
    }

    private void touchPeer(String peerId) {
        if (peerId == null || peerId.isBlank()) {
            return;
        }
        PeerSyncStatus status = peers.get(peerId);
        long count = status == null ? 0L : status.messageCount();
        peers.put(peerId, new PeerSyncStatus(peerId, System.currentTimeMillis(), count + 1, true));
    }

    private void onReassemblyTimeout(List<String> messageIds) {
        log(MeshEventLog.MeshEvent.warn("chunk.reassemble", "timeout", null, Map.of(
                "evicted", messageIds.size(),
                "message_ids", messageIds
        )));
    }

    private long nextTimestamp() {
        // Strictly increasing so two messages of one node never share a dedup identity.
        long now = System.currentTimeMillis();
        lastTimestampMs = Math.max(now, lastTimestampMs + 1);
        return lastTimestampMs;
    }

    private int effectivePayloadLimit() {
        return Math.min(settings.maxPayloadBytes(), transport.maxPayloadBytes());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Gossip engine " + nodeId + " is closed");
        }
    }

    private void log(MeshEventLog.MeshEvent event) {
        eventLog.log(event);
    }

    private static Map<String, Object> postDetails(SurvivalPost post) {
        return Map.of(
                "post_id", post.id(),
                "kind", post.kind().name(),
                "priority", post.priority().name()
        );
    }

    private <T> T onActor(Callable<T> task) {
        try {
            if (Thread.currentThread() == actorThread) {
                return task.call();
            }
            return actor.submit(task).get();
        } catch (RejectedExecutionException e) {
            // The actor is gone after close; reads see the final state.
            return callDirectly(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for gossip engine " + nodeId, e);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Gossip engine task failed", e);
        }
    }

    private <T> T callDirectly(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Gossip engine task failed", e);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Gossip engine task failed", cause);
    }

    private void submitEvent(String kind, String peerId, Runnable event) {
        if (closed) {
            return;
        }
        try {
            actor.execute(() -> {
                try {
                    event.run();
                } catch (RuntimeException e) {
                    log(MeshEventLog.MeshEvent.error("event." + kind, "failed", peerId, Map.of(
                            "error", String.valueOf(e.getMessage())
                    )));
                }
            });
        } catch (RejectedExecutionException e) {
            log(MeshEventLog.MeshEvent.info("event." + kind, "ignored_after_close", peerId, Map.of()));
        }
    }

    private static void awaitQuietly(ExecutorService executor) {
        try {
            if (!executor.awaitTermination(CLOSE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class EngineListener implements TransportListener {
        @Override
        public void onPayloadReceived(String peerId, String payload) {
            submitEvent("payload", peerId, () -> handlePayload(peerId, payload));
        }

        @Override
        public void onEndpointFound(String peerId, String name) {
            submitEvent("found", peerId, () -> handleEndpointFound(peerId, name));
        }

        @Override
        public void onEndpointLost(String peerId) {
            submitEvent("lost", peerId, () -> handleEndpointLost(peerId));
        }
    }

    private record SendOutcome(int frames, RuntimeException failure, boolean capacity) {
        static SendOutcome ok(int frames) {
            return new SendOutcome(frames, null, false);
        }

        static SendOutcome failed(RuntimeException failure) {
            return new SendOutcome(0, failure, false);
        }

        static SendOutcome capacity(ChunkingException failure) {
            return new SendOutcome(0, failure, true);
        }
    }
}

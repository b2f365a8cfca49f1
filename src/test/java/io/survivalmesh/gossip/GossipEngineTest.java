package io.survivalmesh.gossip;

import com.fasterxml.jackson.databind.node.ArrayNode;
import io.survivalmesh.Polling;
import io.survivalmesh.chunk.MessageChunk;
import io.survivalmesh.chunk.MessageChunker;
import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.GossipSettings;
import io.survivalmesh.model.ComingAck;
import io.survivalmesh.model.GossipMessage;
import io.survivalmesh.model.MessageType;
import io.survivalmesh.model.PeerSyncStatus;
import io.survivalmesh.model.PostKind;
import io.survivalmesh.model.Priority;
import io.survivalmesh.model.SurvivalPost;
import io.survivalmesh.observability.MeshEventLog;
import io.survivalmesh.transport.LoopbackMesh;
import io.survivalmesh.transport.TransportListener;
import io.survivalmesh.util.Ids;
import io.survivalmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

final class GossipEngineTest {
    private static final GossipSettings FAST = GossipSettings.defaults().withTiming(List.of(5L, 5L, 5L, 5L), 1L);

    @Test
    void localSosPostIsStoredAndQueuedOnceAtSosPriority() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            SurvivalPost sos = new SurvivalPost(PostKind.SOS, "Need water", 3, 1_700_000_000L, "sos0001");
            engine.addLocalPost(sos);

            Assertions.assertEquals(List.of(sos), engine.getLocalPosts());
            List<QueueEntry> pending = engine.pendingEntries();
            Assertions.assertEquals(1, pending.size());
            Assertions.assertEquals(Priority.SOS, pending.get(0).priority());
            Assertions.assertEquals(MessageType.POST_UPDATE, pending.get(0).message().type());
            Assertions.assertEquals(1, engine.getQueueStats().queueLength());
            Assertions.assertEquals(1, engine.getQueueStats().localPostCount());
        }
    }

    @Test
    void invalidLocalPostIsRejected() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            Assertions.assertThrows(
                    IllegalArgumentException.class,
                    () -> engine.addLocalPost(new SurvivalPost(PostKind.HAVE, "", 3, 1L, "have001"))
            );
            Assertions.assertEquals(0, engine.getQueueStats().queueLength());
        }
    }

    @Test
    void queueSendsSosBeforeWantBeforeHaveBeforeAck() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.addLocalPost(post(PostKind.HAVE, "have001"));
            engine.sendComingAck("have001", "4");
            engine.addLocalPost(post(PostKind.WANT, "want001"));
            engine.addLocalPost(post(PostKind.HAVE, "have002"));
            engine.addLocalPost(post(PostKind.SOS, "sos0001"));

            List<Priority> order = new ArrayList<>();
            for (QueueEntry entry : engine.pendingEntries()) {
                order.add(entry.priority());
            }
            Assertions.assertEquals(List.of(Priority.SOS, Priority.WANT, Priority.HAVE, Priority.HAVE, Priority.ACK), order);
            Assertions.assertEquals("have001", engine.pendingEntries().get(2).message().payload().get(0).get("id").asText());
        }
    }

    @Test
    void broadcastLocalPostsIsPlacedByMostUrgentPost() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            Assertions.assertFalse(engine.broadcastLocalPosts());
            Assertions.assertEquals(0, engine.getQueueStats().queueLength());

            engine.addLocalPost(post(PostKind.HAVE, "have001"));
            engine.addLocalPost(post(PostKind.WANT, "want001"));
            Assertions.assertTrue(engine.broadcastLocalPosts());

            QueueEntry batch = engine.pendingEntries().stream()
                    .filter(e -> e.message().type() == MessageType.POST_LIST)
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(Priority.WANT, batch.priority());
            Assertions.assertEquals(2, batch.message().payloadEntryCount());
            Assertions.assertEquals("want001", batch.message().payload().get(0).get("id").asText());
        }
    }

    @Test
    void partitionHealAddsExactlyOneBroadcast() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.addLocalPost(post(PostKind.HAVE, "have001"));
            engine.addLocalPost(post(PostKind.SOS, "sos0001"));
            int before = engine.getQueueStats().queueLength();

            Assertions.assertTrue(engine.handlePartitionHeal("node-b"));

            Assertions.assertEquals(before + 1, engine.getQueueStats().queueLength());
        }
    }

    @Test
    void receivingTheSameMessageTwiceYieldsNothingNew() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            GossipMessage message = GossipMessage.ofPosts(
                    MessageType.POST_LIST,
                    List.of(post(PostKind.SOS, "sos0001"), post(PostKind.HAVE, "have001")),
                    "node-b",
                    1_000L
            );
            Assertions.assertEquals(2, engine.receiveMessage(message, "node-b").size());
            Assertions.assertEquals(List.of(), engine.receiveMessage(message, "node-b"));

            GossipStats stats = engine.getQueueStats();
            Assertions.assertEquals(1L, stats.duplicateTotal());
            Assertions.assertEquals(1, stats.seenMessageCount());
            Assertions.assertEquals(2, stats.localPostCount());
        }
    }

    @Test
    void messageAtHopLimitIsDropped() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            GossipMessage fresh = GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.SOS, "sos0001")), "node-b", 1_000L);
            GossipMessage atLimit = new GossipMessage(fresh.type(), fresh.payload(), 5, fresh.timestamp(), fresh.senderId());

            Assertions.assertEquals(List.of(), engine.receiveMessage(atLimit, "node-b"));
            Assertions.assertEquals(0, engine.getLocalPosts().size());
            Assertions.assertEquals(1L, engine.getQueueStats().hopLimitedTotal());

            GossipMessage belowLimit = new GossipMessage(fresh.type(), fresh.payload(), 4, fresh.timestamp(), fresh.senderId());
            Assertions.assertEquals(1, engine.receiveMessage(belowLimit, "node-b").size());
        }
    }

    @Test
    void negativeHopCountIsRejectedAsMalformed() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            GossipMessage fresh = GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.SOS, "sos0001")), "node-b", 1_000L);
            GossipMessage forged = new GossipMessage(fresh.type(), fresh.payload(), -100, fresh.timestamp(), fresh.senderId());

            Assertions.assertEquals(List.of(), engine.receiveMessage(forged, "node-b"));
            Assertions.assertEquals(0, engine.getLocalPosts().size());
            Assertions.assertEquals(0, engine.getQueueStats().queueLength());
            Assertions.assertEquals(0, engine.getQueueStats().seenMessageCount());
            Assertions.assertEquals(1L, engine.getQueueStats().invalidPostsTotal());
        }
    }

    @Test
    void newPostsAreRelayedWithOneMoreHopAtBestPriority() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            GossipMessage message = GossipMessage.ofPosts(
                    MessageType.POST_LIST,
                    List.of(post(PostKind.HAVE, "have001"), post(PostKind.WANT, "want001")),
                    "node-b",
                    1_000L
            );
            GossipMessage hop2 = new GossipMessage(message.type(), message.payload(), 2, message.timestamp(), message.senderId());
            engine.receiveMessage(hop2, "node-b");

            List<QueueEntry> pending = engine.pendingEntries();
            Assertions.assertEquals(1, pending.size());
            Assertions.assertEquals(Priority.WANT, pending.get(0).priority());
            Assertions.assertEquals(3, pending.get(0).message().hopCount());
            Assertions.assertEquals("node-a", pending.get(0).message().senderId());
            Assertions.assertEquals(1_000L, pending.get(0).message().timestamp());

            GossipMessage known = GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.HAVE, "have001")), "node-c", 2_000L);
            Assertions.assertEquals(List.of(), engine.receiveMessage(known, "node-c"));
            Assertions.assertEquals(1, engine.pendingEntries().size());
        }
    }

    @Test
    void invalidEntriesAreDroppedIndividually() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            ArrayNode payload = Jsons.compact().createArrayNode();
            payload.add(Jsons.compact().valueToTree(post(PostKind.SOS, "sos0001")));
            payload.addObject().put("t", "x").put("i", "bogus").put("h", 1).put("ts", 1).put("id", "bad0001");
            payload.add(Jsons.compact().valueToTree(new SurvivalPost(PostKind.HAVE, "a".repeat(101), 1, 1L, "have001")));
            payload.add("not an object");
            GossipMessage message = new GossipMessage(MessageType.POST_LIST, payload, 0, 1_000L, "node-b");

            List<SurvivalPost> added = engine.receiveMessage(message, "node-b");

            Assertions.assertEquals(1, added.size());
            Assertions.assertEquals("sos0001", added.get(0).id());
            Assertions.assertEquals(3L, engine.getQueueStats().invalidPostsTotal());
        }
    }

    @Test
    void structurallyBrokenEnvelopeIsIgnored() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            Assertions.assertEquals(List.of(), engine.receiveMessage(new GossipMessage(MessageType.POST_LIST, null, 0, 1L, "node-b"), "node-b"));
            Assertions.assertEquals(List.of(), engine.receiveMessage(new GossipMessage(null, Jsons.compact().createArrayNode(), 0, 1L, "node-b"), "node-b"));
            Assertions.assertEquals(List.of(), engine.receiveMessage(null, "node-b"));
            Assertions.assertEquals(0, engine.getQueueStats().seenMessageCount());
        }
    }

    @Test
    void peerSyncStatusCountsMessages() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.receiveMessage(GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.HAVE, "have001")), "node-b", 1L), "node-b");
            engine.receiveMessage(GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.HAVE, "have002")), "node-b", 2L), "node-b");

            PeerSyncStatus status = engine.getPeerSyncStatus().get("node-b");
            Assertions.assertEquals(2L, status.messageCount());
            Assertions.assertTrue(status.connected());
            Assertions.assertTrue(status.lastSyncTimeMs() > 0L);
        }
    }

    @Test
    void seenSetIsClearedWholesaleAtItsLimit() {
        GossipSettings small = GossipSettings.fromFile(
                new GossipSettings.SettingsFile(null, null, null, null, null, null, null, 16, null, null, null, null, null),
                FAST
        );
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, small)) {
            for (long ts = 1; ts <= 16; ts++) {
                engine.receiveMessage(emptyList("node-b", ts), "node-b");
            }
            Assertions.assertEquals(16, engine.getQueueStats().seenMessageCount());

            engine.receiveMessage(emptyList("node-b", 17L), "node-b");
            Assertions.assertEquals(1, engine.getQueueStats().seenMessageCount());

            engine.receiveMessage(emptyList("node-b", 1L), "node-b");
            Assertions.assertEquals(0L, engine.getQueueStats().duplicateTotal());

            engine.clearSeenMessages();
            Assertions.assertEquals(0, engine.getQueueStats().seenMessageCount());
        }
    }

    @Test
    void ackAddsResponderAndIsRelayedOnlyWhenItChangesState() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.addLocalPost(post(PostKind.SOS, "sos0001"));

            GossipMessage ack = GossipMessage.ofAck(new ComingAck("sos0001", "12"), "node-b", 500L);
            Assertions.assertEquals(List.of(), engine.receiveMessage(ack, "node-b"));
            Assertions.assertTrue(engine.getLocalPosts().get(0).hasResponder("12"));

            List<QueueEntry> pending = engine.pendingEntries();
            Assertions.assertEquals(2, pending.size());
            QueueEntry relayed = pending.get(1);
            Assertions.assertEquals(Priority.ACK, relayed.priority());
            Assertions.assertEquals(MessageType.ACK, relayed.message().type());
            Assertions.assertEquals(1, relayed.message().hopCount());

            GossipMessage again = GossipMessage.ofAck(new ComingAck("sos0001", "12"), "node-c", 501L);
            engine.receiveMessage(again, "node-c");
            GossipMessage unknown = GossipMessage.ofAck(new ComingAck("zzz0001", "12"), "node-c", 502L);
            engine.receiveMessage(unknown, "node-c");
            Assertions.assertEquals(2, engine.pendingEntries().size());
        }
    }

    @Test
    void sendComingAckUpdatesLocalCopyAndQueuesAck() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.addLocalPost(post(PostKind.WANT, "want001"));
            engine.sendComingAck("want001", "7");

            Assertions.assertEquals(List.of("7"), engine.getLocalPosts().get(0).responders());
            QueueEntry last = engine.pendingEntries().get(1);
            Assertions.assertEquals(Priority.ACK, last.priority());
            Assertions.assertEquals("want001", last.message().payload().get("postId").asText());
            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.sendComingAck("short", "7"));
        }
    }

    @Test
    void resolveRemoveAndUpdateLocalPosts() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            engine.addLocalPost(post(PostKind.SOS, "sos0001"));
            engine.addLocalPost(post(PostKind.HAVE, "have001"));

            SurvivalPost resolved = engine.resolveSos("sos0001").orElseThrow();
            Assertions.assertEquals(Boolean.TRUE, resolved.resolved());
            Assertions.assertEquals(3, engine.getQueueStats().queueLength());
            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.resolveSos("have001"));
            Assertions.assertTrue(engine.resolveSos("missing1").isEmpty());

            SurvivalPost renamed = engine.updateLocalPost("have001", p -> new SurvivalPost(
                    p.kind(), "Two blankets", p.houseNumber(), p.timestampSec(), p.id())).orElseThrow();
            Assertions.assertEquals("Two blankets", renamed.item());
            Assertions.assertThrows(IllegalArgumentException.class, () -> engine.updateLocalPost("have001", p -> new SurvivalPost(
                    p.kind(), p.item(), p.houseNumber(), p.timestampSec(), "other01")));

            Assertions.assertTrue(engine.removeLocalPost("have001"));
            Assertions.assertFalse(engine.removeLocalPost("have001"));
            Assertions.assertEquals(1, engine.getLocalPosts().size());
        }
    }

    @Test
    void receivedUpdateReplacesKnownPost() {
        try (LoopbackMesh mesh = new LoopbackMesh(512);
             GossipEngine engine = engine("node-a", mesh, FAST)) {
            SurvivalPost sos = post(PostKind.SOS, "sos0001");
            engine.receiveMessage(GossipMessage.ofPosts(MessageType.POST_LIST, List.of(sos), "node-b", 1L), "node-b");
            int queued = engine.getQueueStats().queueLength();

            GossipMessage update = GossipMessage.ofPosts(MessageType.POST_UPDATE, List.of(sos.withResolved(true)), "node-b", 2L);
            Assertions.assertEquals(List.of(), engine.receiveMessage(update, "node-b"));
            Assertions.assertEquals(Boolean.TRUE, engine.getLocalPosts().get(0).resolved());
            Assertions.assertEquals(queued + 1, engine.getQueueStats().queueLength());
        }
    }

    @Test
    void failingRadioExhaustsBackoffThenDrops() throws Exception {
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint endpoint = mesh.join("node-a");
            endpoint.setFailing(true);
            try (GossipEngine engine = new GossipEngine("node-a", FAST, endpoint, MeshEventLog.inMemory("node-a", 100))) {
                engine.start();
                engine.addLocalPost(post(PostKind.SOS, "sos0001"));
                engine.addLocalPost(post(PostKind.HAVE, "have001"));

                Polling.await("both entries dropped", 5_000L, () -> {
                    GossipStats stats = engine.getQueueStats();
                    return stats.droppedTotal() == 2L && stats.queueLength() == 0 && stats.pendingRetries() == 0 && !stats.inFlight();
                });

                GossipStats stats = engine.getQueueStats();
                Assertions.assertEquals(10L, endpoint.sendAttempts());
                Assertions.assertEquals(10L, stats.failedAttemptsTotal());
                Assertions.assertEquals(0L, stats.sentTotal());
                Assertions.assertEquals(2, stats.unresolvedFailures());
            }
        }
    }

    @Test
    void closeCancelsPendingRetriesAndUnsubscribes() throws Exception {
        GossipSettings slowRetry = GossipSettings.defaults().withTiming(List.of(60_000L), 1L);
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint endpoint = mesh.join("node-a");
            endpoint.setFailing(true);
            GossipEngine engine = new GossipEngine("node-a", slowRetry, endpoint, MeshEventLog.inMemory("node-a", 100));
            engine.start();
            Assertions.assertEquals(1, endpoint.listenerCount());
            engine.addLocalPost(post(PostKind.SOS, "sos0001"));
            Polling.await("retry scheduled", 5_000L, () -> engine.getQueueStats().pendingRetries() == 1);

            engine.close();
            engine.close();

            Assertions.assertEquals(0, engine.getQueueStats().pendingRetries());
            Assertions.assertEquals(0, endpoint.listenerCount());
            Assertions.assertEquals(1L, endpoint.sendAttempts());
            Assertions.assertThrows(IllegalStateException.class, () -> engine.addLocalPost(post(PostKind.HAVE, "have001")));
        }
    }

    @Test
    void largeSyncIsChunkedAndReassembledByPeer() throws Exception {
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint endpointB = mesh.join("node-b");
            List<String> framesAtB = new CopyOnWriteArrayList<>();
            endpointB.subscribe(new TransportListener() {
                @Override
                public void onPayloadReceived(String peerId, String payload) {
                    framesAtB.add(payload);
                }
            });
            try (GossipEngine a = engine("node-a", mesh, FAST);
                 GossipEngine b = new GossipEngine("node-b", FAST, endpointB, MeshEventLog.inMemory("node-b", 100))) {
                a.start();
                b.start();
                Set<String> ids = new HashSet<>();
                for (int i = 0; i < 8; i++) {
                    SurvivalPost post = new SurvivalPost(PostKind.HAVE, Ids.randomBase36(60), 10 + i, 1_700_000_000L, "have00" + i);
                    a.addLocalPost(post);
                    ids.add(post.id());
                }
                Polling.await("local sends drained", 5_000L, () -> a.getQueueStats().queueLength() == 0 && !a.getQueueStats().inFlight());

                mesh.link("node-a", "node-b");

                Polling.await("peer converged", 5_000L, () -> b.getLocalPosts().size() == 8);
                Set<String> received = new HashSet<>();
                for (SurvivalPost post : b.getLocalPosts()) {
                    received.add(post.id());
                }
                Assertions.assertEquals(ids, received);
                Assertions.assertTrue(framesAtB.stream().anyMatch(f -> f.contains("\"messageId\"")));
                for (String frame : framesAtB) {
                    Assertions.assertTrue(PayloadCodec.size(frame) <= 512);
                }
                Assertions.assertEquals(0, b.getQueueStats().partialMessages());
            }
        }
    }

    @Test
    void reconnectAfterLossTriggersPartitionHeal() throws Exception {
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint endpointB = mesh.join("node-b");
            List<String> listsAtB = new CopyOnWriteArrayList<>();
            endpointB.subscribe(new TransportListener() {
                @Override
                public void onPayloadReceived(String peerId, String payload) {
                    if (payload.contains("\"post_list\"")) {
                        listsAtB.add(payload);
                    }
                }
            });
            endpointB.startAdvertising("House B");
            endpointB.startDiscovery();
            try (GossipEngine a = engine("node-a", mesh, FAST)) {
                a.addLocalPost(post(PostKind.SOS, "sos0001"));
                a.start();

                mesh.link("node-a", "node-b");
                Polling.await("discovery sync", 5_000L, () -> listsAtB.size() == 1);

                mesh.unlink("node-a", "node-b");
                Polling.await("peer marked lost", 5_000L, () -> {
                    PeerSyncStatus status = a.getPeerSyncStatus().get("node-b");
                    return status != null && !status.connected();
                });

                mesh.link("node-a", "node-b");
                Polling.await("heal broadcast", 5_000L, () -> listsAtB.size() == 2);
                Assertions.assertTrue(a.getPeerSyncStatus().get("node-b").connected());
            }
        }
    }

    @Test
    void malformedInboundPayloadsNeverStopTheEngine() throws Exception {
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint raw = mesh.join("node-x");
            raw.startAdvertising("X");
            raw.startDiscovery();
            try (GossipEngine a = engine("node-a", mesh, FAST)) {
                a.start();
                mesh.link("node-a", "node-x");

                raw.sendPayload("node-a", "not json");
                raw.sendPayload("node-a", "[1,2,3]");
                raw.sendPayload("node-a", "{\"messageId\":\"m1\",\"chunkIndex\":0,\"totalChunks\":0,\"data\":\"x\",\"checksum\":\"y\"}");
                raw.sendPayload("node-a", "{\"messageId\":\"m2\",\"chunkIndex\":0,\"totalChunks\":1,\"data\":\"@@@\",\"checksum\":\""
                        + PayloadCodec.checksum("@@@") + "\"}");
                raw.sendPayload("node-a", "{\"messageId\":\"m3\",\"chunkIndex\":0,\"totalChunks\":1,\"data\":\"abc\",\"checksum\":\"wrong\"}");
                raw.sendPayload("node-a", Jsons.toCompactJson(
                        GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.WANT, "want001")), "node-x", 9L)));

                Polling.await("valid message applied", 5_000L, () -> a.getLocalPosts().size() == 1);
                Assertions.assertTrue(a.getQueueStats().invalidPostsTotal() >= 3L);
                Assertions.assertEquals(0, a.getQueueStats().partialMessages());
            }
        }
    }

    @Test
    void badFramesOnTheWireNeitherRelayNorBreakReassembly() throws Exception {
        try (LoopbackMesh mesh = new LoopbackMesh(512)) {
            LoopbackMesh.Endpoint raw = mesh.join("node-x");
            raw.startAdvertising("X");
            raw.startDiscovery();
            try (GossipEngine a = engine("node-a", mesh, FAST)) {
                a.start();
                mesh.link("node-a", "node-x");

                GossipMessage forged = GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.SOS, "sos0001")), "node-x", 5L);
                raw.sendPayload("node-a", Jsons.toCompactJson(
                        new GossipMessage(forged.type(), forged.payload(), -100, forged.timestamp(), forged.senderId())));

                String body = Jsons.toCompactJson(
                        GossipMessage.ofPosts(MessageType.POST_LIST, List.of(post(PostKind.HAVE, "have009")), "node-x", 6L));
                List<MessageChunk> chunks = MessageChunker.split(body, 200);
                Assertions.assertTrue(chunks.size() >= 2);
                MessageChunk first = chunks.get(0);
                raw.sendPayload("node-a", Jsons.toCompactJson(first));
                raw.sendPayload("node-a", Jsons.toCompactJson(
                        new MessageChunk(first.messageId(), first.totalChunks() + 5, first.totalChunks(), "zz", first.checksum())));
                for (int i = 1; i < chunks.size(); i++) {
                    raw.sendPayload("node-a", Jsons.toCompactJson(chunks.get(i)));
                }

                Polling.await("chunked post applied", 5_000L, () -> a.getLocalPosts().size() == 1);
                Assertions.assertEquals("have009", a.getLocalPosts().get(0).id());
                Assertions.assertEquals(0, a.getQueueStats().partialMessages());
                Assertions.assertTrue(a.getQueueStats().invalidPostsTotal() >= 2L);
            }
        }
    }

    private static GossipEngine engine(String nodeId, LoopbackMesh mesh, GossipSettings settings) {
        return new GossipEngine(nodeId, settings, mesh.join(nodeId), MeshEventLog.inMemory(nodeId, 100));
    }

    private static SurvivalPost post(PostKind kind, String id) {
        return new SurvivalPost(kind, "item " + id, 3, 1_700_000_000L, id);
    }

    private static GossipMessage emptyList(String sender, long timestamp) {
        return new GossipMessage(MessageType.POST_LIST, Jsons.compact().createArrayNode(), 0, timestamp, sender);
    }
}

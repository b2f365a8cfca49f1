package io.survivalmesh.cli;

import io.survivalmesh.config.GossipSettings;
import io.survivalmesh.gossip.GossipEngine;
import io.survivalmesh.gossip.GossipStats;
import io.survivalmesh.model.PostCategory;
import io.survivalmesh.model.PostKind;
import io.survivalmesh.model.SurvivalPost;
import io.survivalmesh.observability.MeshEventLog;
import io.survivalmesh.transport.LoopbackMesh;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a line of in-process nodes (node-1 .. node-N, each linked to its neighbours) until every
 * node knows every post. With {@code partition} the middle link is cut, a post is added on one
 * side, and the link is restored so the heal path has to carry it across.
 */
final class MeshSimulation {
    private final int nodeCount;
    private final GossipSettings settings;
    private final long convergenceTimeoutMs;
    private final boolean partition;

    MeshSimulation(int nodeCount, GossipSettings settings, long convergenceTimeoutMs, boolean partition) {
        if (nodeCount < 2) {
            throw new IllegalArgumentException("Simulation needs at least 2 nodes");
        }
        this.nodeCount = nodeCount;
        this.settings = settings;
        this.convergenceTimeoutMs = Math.max(100L, convergenceTimeoutMs);
        this.partition = partition;
    }

    SimulationOutcome run() throws InterruptedException {
        List<GossipEngine> engines = new ArrayList<>(nodeCount);
        List<MeshEventLog> logs = new ArrayList<>(nodeCount);
        try (LoopbackMesh mesh = new LoopbackMesh(settings.maxPayloadBytes())) {
            for (int i = 1; i <= nodeCount; i++) {
                String nodeId = "node-" + i;
                MeshEventLog log = MeshEventLog.inMemory(nodeId, settings.errorLogCapacity());
                LoopbackMesh.Endpoint endpoint = mesh.join(nodeId);
                engines.add(new GossipEngine(nodeId, "House " + i, settings, endpoint, log));
                logs.add(log);
            }
            for (int i = 1; i < nodeCount; i++) {
                mesh.link("node-" + i, "node-" + (i + 1));
            }
            for (GossipEngine engine : engines) {
                engine.start();
            }

            long startedAt = System.currentTimeMillis();
            Set<String> expected = new LinkedHashSet<>();
            SurvivalPost sos = SurvivalPost.create(PostKind.SOS, "Need water", 1, PostCategory.OTHER);
            engines.get(0).addLocalPost(sos);
            expected.add(sos.id());
            SurvivalPost have = SurvivalPost.create(PostKind.HAVE, "Spare blankets", nodeCount, null);
            engines.get(nodeCount - 1).addLocalPost(have);
            expected.add(have.id());
            boolean converged = awaitConvergence(engines, expected);

            boolean healed = true;
            if (partition) {
                int left = nodeCount / 2;
                mesh.unlink("node-" + left, "node-" + (left + 1));
                SurvivalPost want = SurvivalPost.create(PostKind.WANT, "Batteries", left, null);
                engines.get(0).addLocalPost(want);
                expected.add(want.id());
                awaitConvergence(engines.subList(0, left), expected);
                mesh.link("node-" + left, "node-" + (left + 1));
                healed = awaitConvergence(engines, expected);
            }
            long elapsedMs = System.currentTimeMillis() - startedAt;

            List<GossipStats> stats = new ArrayList<>(engines.size());
            for (GossipEngine engine : engines) {
                stats.add(engine.getQueueStats());
            }
            return new SimulationOutcome(
                    nodeCount,
                    expected.size(),
                    converged && healed,
                    partition,
                    elapsedMs,
                    mesh.deliveredTotal(),
                    stats
            );
        } finally {
            for (GossipEngine engine : engines) {
                engine.close();
            }
        }
    }

    private boolean awaitConvergence(List<GossipEngine> engines, Set<String> expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + convergenceTimeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (allKnow(engines, expected)) {
                return true;
            }
            Thread.sleep(10L);
        }
        return allKnow(engines, expected);
    }

    private static boolean allKnow(List<GossipEngine> engines, Set<String> expected) {
        for (GossipEngine engine : engines) {
            Set<String> known = new LinkedHashSet<>();
            for (SurvivalPost post : engine.getLocalPosts()) {
                known.add(post.id());
            }
            if (!known.containsAll(expected)) {
                return false;
            }
        }
        return true;
    }

    record SimulationOutcome(
            int nodes,
            int posts,
            boolean converged,
            boolean partitioned,
            long elapsedMs,
            long payloadsDelivered,
            List<GossipStats> stats
    ) {
    }
}

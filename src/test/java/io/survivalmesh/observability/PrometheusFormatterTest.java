package io.survivalmesh.observability;

import io.survivalmesh.gossip.GossipStats;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusFormatterTest {

    @Test
    void rendersGaugesLabelledByNode() {
        String text = PrometheusFormatter.format(stats("node-a", 3, true));
        assertTrue(text.contains("# TYPE survivalmesh_queue_length gauge\n"));
        assertTrue(text.contains("survivalmesh_queue_length{node=\"node-a\"} 3\n"));
        assertTrue(text.contains("survivalmesh_send_in_flight{node=\"node-a\"} 1\n"));
        assertTrue(text.contains("survivalmesh_dropped_total{node=\"node-a\"} 2\n"));
        assertTrue(text.indexOf("survivalmesh_queue_length") < text.indexOf("survivalmesh_unresolved_failures"));
    }

    @Test
    void multipleNodesShareOneHelpLinePerMetric() {
        String text = PrometheusFormatter.format(List.of(stats("node-a", 1, false), stats("node-b", 4, false)));
        assertEquals(text.indexOf("# HELP survivalmesh_queue_length "), text.lastIndexOf("# HELP survivalmesh_queue_length "));
        assertTrue(text.contains("survivalmesh_queue_length{node=\"node-b\"} 4\n"));
    }

    @Test
    void escapesLabelValues() {
        String text = PrometheusFormatter.format(stats("odd\"node\\", 0, false));
        assertTrue(text.contains("{node=\"odd\\\"node\\\\\"}"));
    }

    private static GossipStats stats(String nodeId, int queueLength, boolean inFlight) {
        return new GossipStats(nodeId, queueLength, inFlight, 5, 7, 2, 1, 0, 0, 10L, 4L, 2L, 1L, 0L, 3L, 2);
    }
}

package io.survivalmesh.observability;

import io.survivalmesh.gossip.GossipStats;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

public final class PrometheusFormatter {
    private static final Map<String, Gauge> GAUGES = gauges();

    private PrometheusFormatter() {
    }

    public static String format(GossipStats stats) {
        return format(List.of(stats));
    }

    /**
     * Renders one sample per node for every gauge, labelled with the node id.
     */
    public static String format(Collection<GossipStats> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Gauge> e : GAUGES.entrySet()) {
            for (GossipStats stats : nodes) {
                appendGauge(sb, e.getKey(), e.getValue().help(), "node", stats.nodeId(), e.getValue().value().applyAsLong(stats));
            }
        }
        return sb.toString();
    }

    private static Map<String, Gauge> gauges() {
        Map<String, Gauge> out = new LinkedHashMap<>();
        out.put("survivalmesh_queue_length", new Gauge("Entries waiting in the send queue", GossipStats::queueLength));
        out.put("survivalmesh_send_in_flight", new Gauge("Whether a send is in flight (1=yes,0=no)", s -> s.inFlight() ? 1L : 0L));
        out.put("survivalmesh_local_posts", new Gauge("Posts known to this node", GossipStats::localPostCount));
        out.put("survivalmesh_seen_messages", new Gauge("Message identities in the dedup set", GossipStats::seenMessageCount));
        out.put("survivalmesh_peers_total", new Gauge("Peers ever seen", GossipStats::peerCount));
        out.put("survivalmesh_peers_connected", new Gauge("Peers currently in range", GossipStats::connectedPeerCount));
        out.put("survivalmesh_pending_retries", new Gauge("Sends waiting on a backoff timer", GossipStats::pendingRetries));
        out.put("survivalmesh_partial_messages", new Gauge("Chunked messages still being reassembled", GossipStats::partialMessages));
        out.put("survivalmesh_sent_total", new Gauge("Queue entries sent without transport error", GossipStats::sentTotal));
        out.put("survivalmesh_send_failures_total", new Gauge("Failed send attempts", GossipStats::failedAttemptsTotal));
        out.put("survivalmesh_dropped_total", new Gauge("Queue entries dropped after retries or for capacity", GossipStats::droppedTotal));
        out.put("survivalmesh_duplicate_total", new Gauge("Received messages dropped as already seen", GossipStats::duplicateTotal));
        out.put("survivalmesh_hop_limited_total", new Gauge("Received messages dropped at the hop limit", GossipStats::hopLimitedTotal));
        out.put("survivalmesh_invalid_total", new Gauge("Malformed payloads and posts discarded", GossipStats::invalidPostsTotal));
        out.put("survivalmesh_unresolved_failures", new Gauge("Unresolved failures in the event log", GossipStats::unresolvedFailures));
        return out;
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    private record Gauge(String help, ToLongFunction<GossipStats> value) {
    }
}

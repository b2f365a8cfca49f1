package io.survivalmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.survivalmesh.util.Jsons;

import java.util.List;

/**
 * Wire envelope. {@code payload} is kept as a raw JSON tree so each post can be validated on
 * its own; one malformed entry never rejects the batch.
 */
@JsonPropertyOrder({"type", "payload", "hopCount", "timestamp", "senderId"})
public record GossipMessage(
        MessageType type,
        JsonNode payload,
        int hopCount,
        long timestamp,
        String senderId
) {
    public static GossipMessage ofPosts(MessageType type, List<SurvivalPost> posts, String senderId, long timestampMs) {
        ArrayNode array = Jsons.compact().createArrayNode();
        for (SurvivalPost post : posts) {
            array.add(Jsons.compact().valueToTree(post));
        }
        return new GossipMessage(type, array, 0, timestampMs, senderId);
    }

    public static GossipMessage ofAck(ComingAck ack, String senderId, long timestampMs) {
        return new GossipMessage(MessageType.ACK, Jsons.compact().valueToTree(ack), 0, timestampMs, senderId);
    }

    /**
     * Copy forwarded by {@code relayNodeId}: one more hop, same origination timestamp.
     */
    public GossipMessage relayed(String relayNodeId) {
        return new GossipMessage(type, payload, hopCount + 1, timestamp, relayNodeId);
    }

    /**
     * Dedup key: sender, origination timestamp and type.
     */
    @JsonIgnore
    public String identity() {
        return senderId + "-" + timestamp + "-" + (type == null ? "?" : type.wireName());
    }

    @JsonIgnore
    public int payloadEntryCount() {
        if (payload == null || payload.isNull()) {
            return 0;
        }
        return payload.isArray() ? payload.size() : 1;
    }
}

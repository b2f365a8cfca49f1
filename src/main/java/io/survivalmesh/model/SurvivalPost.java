package io.survivalmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.SurvivalMeshConfig;
import io.survivalmesh.util.Ids;
import io.survivalmesh.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A have / want / SOS post as it travels over the radio. Keys are single letters to keep the
 * serialized form small; optional fields are omitted when unset.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"t", "i", "h", "ts", "id", "r", "c", "resolved"})
public record SurvivalPost(
        @JsonProperty("t") PostKind kind,
        @JsonProperty("i") String item,
        @JsonProperty("h") int houseNumber,
        @JsonProperty("ts") long timestampSec,
        @JsonProperty("id") String id,
        @JsonProperty("r") List<String> responders,
        @JsonProperty("c") PostCategory category,
        @JsonProperty("resolved") Boolean resolved
) {
    public SurvivalPost {
        responders = responders == null ? null : List.copyOf(responders);
    }

    public SurvivalPost(PostKind kind, String item, int houseNumber, long timestampSec, String id) {
        this(kind, item, houseNumber, timestampSec, id, null, null, null);
    }

    /**
     * Builds a fresh post with a generated id and the current Unix second. The category is only
     * kept for SOS posts.
     *
     * @throws IllegalArgumentException if the trimmed item is empty or too long, the house number
     *                                  is not positive, or the serialized post exceeds 512 bytes
     */
    public static SurvivalPost create(PostKind kind, String item, int houseNumber, PostCategory category) {
        String trimmed = item == null ? "" : item.trim();
        if (trimmed.isEmpty() || PayloadCodec.size(trimmed) > SurvivalMeshConfig.DEFAULT_MAX_DESCRIPTION_BYTES) {
            throw new IllegalArgumentException(
                    "Post item must be 1.." + SurvivalMeshConfig.DEFAULT_MAX_DESCRIPTION_BYTES + " bytes"
            );
        }
        if (houseNumber <= 0) {
            throw new IllegalArgumentException("House number must be positive: " + houseNumber);
        }
        SurvivalPost post = new SurvivalPost(
                kind,
                trimmed,
                houseNumber,
                Instant.now().getEpochSecond(),
                Ids.newPostId(),
                null,
                kind == PostKind.SOS ? category : null,
                null
        );
        int size = post.serializedSize();
        if (size > SurvivalMeshConfig.MAX_SERIALIZED_POST_BYTES) {
            throw new IllegalArgumentException("Serialized post is " + size + " bytes, max="
                    + SurvivalMeshConfig.MAX_SERIALIZED_POST_BYTES);
        }
        return post;
    }

    @JsonIgnore
    public Priority priority() {
        return Priority.forKind(kind);
    }

    @JsonIgnore
    public int serializedSize() {
        return PayloadCodec.size(Jsons.toCompactJson(this));
    }

    @JsonIgnore
    public boolean hasResponder(String responder) {
        return responders != null && responders.contains(responder);
    }

    public SurvivalPost withResponder(String responder) {
        if (hasResponder(responder)) {
            return this;
        }
        List<String> next = responders == null ? new ArrayList<>() : new ArrayList<>(responders);
        next.add(responder);
        return new SurvivalPost(kind, item, houseNumber, timestampSec, id, next, category, resolved);
    }

    public SurvivalPost withResolved(boolean value) {
        return new SurvivalPost(kind, item, houseNumber, timestampSec, id, responders, category, value);
    }
}

package io.survivalmesh.gossip;

import com.fasterxml.jackson.databind.JsonNode;
import io.survivalmesh.codec.PayloadCodec;
import io.survivalmesh.config.GossipSettings;
import io.survivalmesh.model.ComingAck;
import io.survivalmesh.model.PostCategory;
import io.survivalmesh.model.PostKind;
import io.survivalmesh.model.SurvivalPost;
import io.survivalmesh.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural checks shared by locally created and received posts.
 */
public final class PostValidator {
    private final int minIdLength;
    private final int maxIdLength;
    private final int maxDescriptionBytes;

    public PostValidator(GossipSettings settings) {
        this(settings.postIdMinLength(), settings.postIdMaxLength(), settings.maxDescriptionBytes());
    }

    public PostValidator(int minIdLength, int maxIdLength, int maxDescriptionBytes) {
        this.minIdLength = minIdLength;
        this.maxIdLength = maxIdLength;
        this.maxDescriptionBytes = maxDescriptionBytes;
    }

    /**
     * Returns null when the post is valid, otherwise a short reason.
     */
    public String problem(SurvivalPost post) {
        if (post == null) {
            return "missing";
        }
        return problem(Jsons.compact().valueToTree(post));
    }

    public String problem(JsonNode node) {
        if (node == null || !node.isObject()) {
            return "not_an_object";
        }
        JsonNode kind = node.get("t");
        if (kind == null || !kind.isTextual() || !PostKind.isWireCode(kind.asText())) {
            return "bad_kind";
        }
        JsonNode item = node.get("i");
        if (item == null || !item.isTextual() || item.asText().isEmpty()) {
            return "missing_item";
        }
        if (PayloadCodec.size(item.asText()) > maxDescriptionBytes) {
            return "item_too_long";
        }
        JsonNode house = node.get("h");
        if (house == null || !house.isIntegralNumber() || !house.canConvertToInt() || house.asInt() <= 0) {
            return "bad_house_number";
        }
        JsonNode ts = node.get("ts");
        if (ts == null || !ts.isIntegralNumber() || !ts.canConvertToLong() || ts.asLong() <= 0L) {
            return "bad_timestamp";
        }
        JsonNode id = node.get("id");
        if (id == null || !id.isTextual()) {
            return "missing_id";
        }
        int idLength = id.asText().length();
        if (idLength < minIdLength || idLength > maxIdLength) {
            return "bad_id_length";
        }
        JsonNode responders = node.get("r");
        if (present(responders)) {
            if (!responders.isArray()) {
                return "bad_responders";
            }
            for (JsonNode r : responders) {
                if (!r.isTextual()) {
                    return "bad_responders";
                }
            }
        }
        JsonNode category = node.get("c");
        if (present(category) && (!category.isTextual() || !PostCategory.isWireCode(category.asText()))) {
            return "bad_category";
        }
        JsonNode resolved = node.get("resolved");
        if (present(resolved) && !resolved.isBoolean()) {
            return "bad_resolved";
        }
        return null;
    }

    public Optional<SurvivalPost> parse(JsonNode node) {
        if (problem(node) != null) {
            return Optional.empty();
        }
        List<String> responders = null;
        JsonNode r = node.get("r");
        if (present(r)) {
            responders = new ArrayList<>(r.size());
            for (JsonNode value : r) {
                responders.add(value.asText());
            }
        }
        JsonNode c = node.get("c");
        JsonNode resolved = node.get("resolved");
        return Optional.of(new SurvivalPost(
                PostKind.fromCode(node.get("t").asText()),
                node.get("i").asText(),
                node.get("h").asInt(),
                node.get("ts").asLong(),
                node.get("id").asText(),
                responders,
                present(c) ? PostCategory.fromCode(c.asText()) : null,
                present(resolved) ? resolved.asBoolean() : null
        ));
    }

    public Optional<ComingAck> parseAck(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode postId = node.get("postId");
        JsonNode houseNumber = node.get("houseNumber");
        if (postId == null || !postId.isTextual()) {
            return Optional.empty();
        }
        int length = postId.asText().length();
        if (length < minIdLength || length > maxIdLength) {
            return Optional.empty();
        }
        if (houseNumber == null || !houseNumber.isTextual() || houseNumber.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ComingAck(postId.asText(), houseNumber.asText()));
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }
}

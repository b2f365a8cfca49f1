package io.survivalmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    POST_LIST("post_list"),
    POST_UPDATE("post_update"),
    ACK("ack");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MessageType fromWire(String raw) {
        for (MessageType value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown gossip message type: " + raw);
    }
}

package io.survivalmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PostKind {
    HAVE("h"),
    WANT("w"),
    SOS("s");

    private final String code;

    PostKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PostKind fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Post kind is required");
        }
        for (PostKind value : values()) {
            if (value.code.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown post kind: " + raw);
    }

    public static boolean isWireCode(String raw) {
        for (PostKind value : values()) {
            if (value.code.equals(raw)) {
                return true;
            }
        }
        return false;
    }
}

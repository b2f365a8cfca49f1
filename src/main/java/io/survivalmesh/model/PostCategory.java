package io.survivalmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PostCategory {
    MEDICAL("m"),
    SAFETY("s"),
    FIRE("f"),
    OTHER("o");

    private final String code;

    PostCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PostCategory fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (PostCategory value : values()) {
            if (value.code.equals(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown post category: " + raw);
    }

    public static boolean isWireCode(String raw) {
        for (PostCategory value : values()) {
            if (value.code.equals(raw)) {
                return true;
            }
        }
        return false;
    }
}

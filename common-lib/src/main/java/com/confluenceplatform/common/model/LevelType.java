package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LevelType {
    SUPPORT,
    RESISTANCE,
    TARGET,
    INVALIDATION;

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }

    /** Returns null for unrecognized input; validation turns that into a rejection. */
    @JsonCreator
    public static LevelType fromId(String id) {
        if (id == null) return null;
        for (LevelType type : values()) {
            if (type.id().equalsIgnoreCase(id.trim())) return type;
        }
        return null;
    }
}

package com.confluenceplatform.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RecordKind {
    LEVEL,
    VIEW;

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RecordKind fromId(String id) {
        if (id == null) return null;
        for (RecordKind k : values()) {
            if (k.id().equalsIgnoreCase(id.trim())) return k;
        }
        return null;
    }
}

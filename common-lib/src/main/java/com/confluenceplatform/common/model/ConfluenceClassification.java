package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bucketed confluence strength. Thresholds live in
 * {@link com.confluenceplatform.common.confluence.ConfluenceWeights}.
 */
public enum ConfluenceClassification {
    HIGH,
    MEDIUM,
    LOW,
    NONE;

    @JsonValue
    public String id() {
        return name().toLowerCase();
    }
}

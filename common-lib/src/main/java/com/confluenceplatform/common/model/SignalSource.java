package com.confluenceplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Independent research sources that publish views and levels.
 *
 * <p>Serialized by wire id ({@code kt_technical}, {@code discord}, ...). Declaration
 * order is the display order used in summaries and trade setups.
 */
public enum SignalSource {

    KT_TECHNICAL("kt_technical"),
    DISCORD("discord"),
    MACRO42("macro42"),
    YOUTUBE("youtube"),
    SUBSTACK("substack"),
    TWITTER("twitter");

    private static final Map<String, SignalSource> BY_ID = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(SignalSource::id, Function.identity()));

    private final String id;

    SignalSource(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a wire id (case-insensitive). Returns null for unrecognized ids so that
     * the record is rejected by validation rather than failing deserialization.
     */
    @JsonCreator
    public static SignalSource fromId(String id) {
        if (id == null) return null;
        return BY_ID.get(id.trim().toLowerCase());
    }
}

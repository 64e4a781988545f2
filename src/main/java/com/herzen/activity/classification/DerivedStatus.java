package com.herzen.activity.classification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum DerivedStatus {
    ENGAGED("engaged"),
    ATTENTION_DRIFT("attention_drift"),
    CONTENT_FRICTION("content_friction");

    private final String wireName;

    DerivedStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a stored or serialized name; {@code null} and unknown names map to {@code null} (unclassified).
     */
    @JsonCreator
    public static DerivedStatus fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(s -> s.wireName.equalsIgnoreCase(value))
                .findFirst()
                .orElse(null);
    }
}

package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Alert and incident severity. Declaration order is the severity order,
 * so {@link #max(Severity, Severity)} never compares strings.
 */
public enum Severity {
    LOW(10),
    MEDIUM(30),
    HIGH(60),
    CRITICAL(90);

    private final int score;

    Severity(int score) {
        this.score = score;
    }

    /** Base urgency contributed to the priority score. */
    public int score() {
        return score;
    }

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; empty for unknown values. */
    public static Optional<Severity> parse(String value) {
        if (value == null) return Optional.empty();
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + value));
    }
}

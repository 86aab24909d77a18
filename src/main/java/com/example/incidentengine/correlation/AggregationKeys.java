package com.example.incidentengine.correlation;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Parsed aggregation key pattern such as {@code asset|signature}.
 * Known tokens: asset, signature, tool_source, severity.
 */
public final class AggregationKeys {

    public static final String DEFAULT_PATTERN = "asset|signature";

    enum Token {
        ASSET, SIGNATURE, TOOL_SOURCE, SEVERITY
    }

    private final List<Token> tokens;
    private final String pattern;

    private AggregationKeys(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.pattern = tokens.stream().map(t -> t.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|"));
    }

    public static AggregationKeys parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new ValidationException("aggregation_key must not be empty");
        }
        List<Token> tokens = new ArrayList<>();
        for (String part : pattern.split("\\|")) {
            String name = part.trim().toUpperCase(Locale.ROOT);
            Token token;
            try {
                token = Token.valueOf(name);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("Unknown aggregation key token '" + part.trim()
                        + "', expected asset, signature, tool_source or severity");
            }
            if (tokens.contains(token)) {
                throw new ValidationException("Duplicate aggregation key token '" + part.trim() + "'");
            }
            tokens.add(token);
        }
        return new AggregationKeys(tokens);
    }

    public String keyFor(Alert alert) {
        return tokens.stream()
                .map(token -> switch (token) {
                    case ASSET -> alert.getAssetName();
                    case SIGNATURE -> alert.getSignature();
                    case TOOL_SOURCE -> alert.getToolSource();
                    case SEVERITY -> alert.getSeverity().value();
                })
                .collect(Collectors.joining("|"));
    }

    /** Canonical form of the pattern, lower case without whitespace. */
    public String pattern() {
        return pattern;
    }
}

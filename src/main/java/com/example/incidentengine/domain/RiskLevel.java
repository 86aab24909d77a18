package com.example.incidentengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Risk tier of a remediation action. Decides whether the action needs human sign-off
 * and which role may give it.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean requiresApproval() {
        return this != LOW;
    }

    /** Whether the given actor may approve or reject an action of this tier for the tenant. */
    public boolean canBeDecidedBy(ActorRole role, String actorTenantId, String requestTenantId) {
        if (role == null) return false;
        return switch (this) {
            case LOW -> true;
            case MEDIUM -> role == ActorRole.MSP_ADMIN
                    || (role == ActorRole.COMPANY_ADMIN && requestTenantId != null
                        && requestTenantId.equals(actorTenantId));
            case HIGH -> role == ActorRole.MSP_ADMIN;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RiskLevel> parse(String value) {
        if (value == null) return Optional.empty();
        for (RiskLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static RiskLevel fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + value));
    }
}

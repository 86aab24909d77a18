package com.example.incidentengine.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Roles known to the engine, lowest privilege first.
 * COMPANY_ADMIN is scoped to its own tenant; MSP_ADMIN spans all tenants.
 */
public enum ActorRole {
    TECHNICIAN,
    COMPANY_ADMIN,
    MSP_ADMIN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ActorRole> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String normalized = value.trim().replace('-', '_');
        for (ActorRole role : values()) {
            if (role.name().equalsIgnoreCase(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}

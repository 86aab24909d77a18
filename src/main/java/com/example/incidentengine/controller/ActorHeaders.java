package com.example.incidentengine.controller;

import com.example.incidentengine.domain.Actor;
import com.example.incidentengine.domain.ActorRole;
import com.example.incidentengine.exception.ValidationException;

/**
 * Builds the calling {@link Actor} from the {@code X-Actor-Id}, {@code X-Actor-Role} and
 * {@code X-Actor-Tenant} headers set by the fronting auth proxy. Missing headers mean an
 * anonymous technician.
 */
final class ActorHeaders {

    static final String ID = "X-Actor-Id";
    static final String ROLE = "X-Actor-Role";
    static final String TENANT = "X-Actor-Tenant";

    private ActorHeaders() {
    }

    static Actor resolve(String id, String role, String tenantId) {
        if ((id == null || id.isBlank()) && (role == null || role.isBlank())) {
            return Actor.anonymous();
        }
        ActorRole actorRole = role == null || role.isBlank() ? ActorRole.TECHNICIAN
                : ActorRole.parse(role).orElseThrow(() -> new ValidationException(
                        "Unknown role '" + role + "', expected technician, company_admin or msp_admin"));
        String actorId = id == null || id.isBlank() ? actorRole.value() : id.trim();
        return new Actor(actorId, actorRole, tenantId == null || tenantId.isBlank() ? null : tenantId.trim());
    }

    static String name(String id) {
        return id == null || id.isBlank() ? "api" : id.trim();
    }
}

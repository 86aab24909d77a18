package com.example.incidentengine.domain;

/**
 * Who is calling: identity, role and the tenant the role is scoped to.
 */
public record Actor(String id, ActorRole role, String tenantId) {

    public static Actor anonymous() {
        return new Actor("anonymous", ActorRole.TECHNICIAN, null);
    }
}

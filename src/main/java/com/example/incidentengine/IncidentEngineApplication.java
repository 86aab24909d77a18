package com.example.incidentengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Incident Lifecycle Engine
 *
 * Turns raw alert deliveries from monitoring tools into scored, SLA-tracked incidents.
 *
 * Architecture:
 * - Ingress Gate → tenant auth, rate limiting, HMAC verification, idempotent accept
 * - Correlation Engine → groups active alerts into incidents by aggregation key
 * - Priority Scorer → deterministic urgency score
 * - SLA Tracker + Escalation Scheduler → deadlines, warnings and the escalation ladder
 * - Approval Gate → risk-tiered dispatch of remediation actions
 * - Gateway → WebSocket JSON-RPC event stream
 */
@SpringBootApplication
public class IncidentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentEngineApplication.class, args);
    }
}

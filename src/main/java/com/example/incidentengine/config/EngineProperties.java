package com.example.incidentengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the incident engine.
 * Maps to the 'incident-engine' prefix in application.yml.
 * Per-tenant settings stored in the database override the defaults held here.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "incident-engine")
public class EngineProperties {

    private List<TenantSeed> tenants = new ArrayList<>();
    private IngressConfig ingress = new IngressConfig();
    private CorrelationConfig correlation = new CorrelationConfig();
    private SlaConfig sla = new SlaConfig();
    private EscalationConfig escalation = new EscalationConfig();
    private ApprovalConfig approvals = new ApprovalConfig();
    private ExecutorConfig executor = new ExecutorConfig();
    private AdvisoryConfig advisory = new AdvisoryConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private GatewayConfig gateway = new GatewayConfig();

    /** Tenants created at startup when they do not exist yet. */
    @Data
    public static class TenantSeed {
        private String id;
        private String name;
        private String apiKey;
    }

    @Data
    public static class IngressConfig {
        private int requestsPerMinute = 60;
        private int burstSize = 100;
        private boolean rateLimitEnabled = true;
        private long maxTimestampDiffSeconds = 300;
        private int idempotencyWindowHours = 24;
        private long idempotencyCacheSize = 100_000;
        private long duplicateWaitMs = 5_000;
    }

    @Data
    public static class CorrelationConfig {
        private int timeWindowMinutes = 15;
        private String aggregationKey = "asset|signature";
        private boolean autoCorrelate = true;
        private int intervalSeconds = 60;
        /** How often the scheduler checks which tenants are due for a pass. */
        private long tickIntervalMs = 5_000;
    }

    @Data
    public static class SlaConfig {
        private boolean enabled = true;
        private Map<String, Integer> responseMinutes = new LinkedHashMap<>(Map.of(
                "critical", 30, "high", 120, "medium", 480, "low", 1440));
        private Map<String, Integer> resolutionMinutes = new LinkedHashMap<>(Map.of(
                "critical", 240, "high", 480, "medium", 1440, "low", 2880));
        private int warningThresholdMinutes = 30;
        private List<String> escalationChain = new ArrayList<>(List.of(
                "technician", "company_admin", "msp_admin"));
    }

    @Data
    public static class EscalationConfig {
        private long tickIntervalMs = 300_000;
    }

    @Data
    public static class ApprovalConfig {
        private int expiryMinutes = 60;
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class ExecutorConfig {
        /** Endpoint of the external remediation executor. Empty disables dispatch over HTTP. */
        private String url = "";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class AdvisoryConfig {
        private double minConfidence = 0.7;
    }

    @Data
    public static class NotificationConfig {
        private SlackConfig slack = new SlackConfig();
        private EmailConfig email = new EmailConfig();

        @Data
        public static class SlackConfig {
            private boolean enabled = false;
            private String webhookUrl = "";
        }

        @Data
        public static class EmailConfig {
            private boolean enabled = false;
            private String from = "incidents@localhost";
        }
    }

    @Data
    public static class GatewayConfig {
        private String websocketPath = "/ws/gateway";
        private int heartbeatTimeoutSeconds = 90;
    }
}

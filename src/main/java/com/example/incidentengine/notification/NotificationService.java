package com.example.incidentengine.notification;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.NotificationOutbox;
import com.example.incidentengine.gateway.GatewayWebSocketHandler;
import com.example.incidentengine.repository.NotificationOutboxRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Notification Service - delivers escalation and SLA warning notices.
 * <p>
 * Notices are first written to the outbox inside the transaction that caused them and only
 * delivered once that transaction has committed. Targets are routed by prefix:
 * {@code slack:<channel or webhook url>}, {@code email:<address>}, anything else is a role
 * name and is pushed to connected dashboards over the gateway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final int MAX_ATTEMPTS = 10;

    private static final MediaType JSON = MediaType.get("application/json");

    private final NotificationOutboxRepository outboxRepository;
    private final EngineProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectProvider<JavaMailSender> mailSender;
    private final ObjectMapper objectMapper;
    private final GatewayWebSocketHandler gatewayHandler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /** Write a notice to the outbox. Must run inside the caller's transaction. */
    public NotificationOutbox enqueue(String tenantId, String incidentId, String kind, String target,
                                      String subject, String body) {
        NotificationOutbox entry = NotificationOutbox.builder()
                .tenantId(tenantId)
                .incidentId(incidentId)
                .kind(kind)
                .target(target != null && !target.isBlank() ? target.trim() : "msp_admin")
                .subject(subject)
                .body(body)
                .createdAt(clock.instant())
                .build();
        return outboxRepository.save(entry);
    }

    /** Deliver committed outbox entries by id. Entries already delivered are skipped. */
    public void deliverAll(Collection<String> outboxIds) {
        for (String id : outboxIds) {
            outboxRepository.findById(id)
                    .filter(entry -> entry.getDeliveredAt() == null)
                    .ifPresent(this::deliver);
        }
    }

    /**
     * Retry everything still undelivered, oldest first.
     *
     * @return number of entries delivered in this round
     */
    public int retryPending() {
        List<NotificationOutbox> pending = outboxRepository.findByDeliveredAtIsNullOrderByCreatedAtAsc();
        int delivered = 0;
        for (NotificationOutbox entry : pending) {
            if (entry.getAttempts() >= MAX_ATTEMPTS) continue;
            if (deliver(entry)) delivered++;
        }
        if (!pending.isEmpty()) {
            log.info("Outbox retry: {} of {} pending notifications delivered", delivered, pending.size());
        }
        return delivered;
    }

    public List<NotificationOutbox> forIncident(String incidentId) {
        return outboxRepository.findByIncidentIdOrderByCreatedAtAsc(incidentId);
    }

    boolean deliver(NotificationOutbox entry) {
        entry.setAttempts(entry.getAttempts() + 1);
        entry.setLastAttemptAt(clock.instant());
        boolean delivered;
        try {
            route(entry);
            entry.setDeliveredAt(clock.instant());
            entry.setLastError(null);
            delivered = true;
        } catch (IOException | RuntimeException e) {
            entry.setLastError(e.getMessage());
            delivered = false;
            if (entry.getAttempts() >= MAX_ATTEMPTS) {
                log.error("Giving up on notification {} to {} after {} attempts: {}",
                        entry.getId(), entry.getTarget(), entry.getAttempts(), e.getMessage());
            } else {
                log.warn("Notification {} to {} failed (attempt {}): {}",
                        entry.getId(), entry.getTarget(), entry.getAttempts(), e.getMessage());
            }
        }
        outboxRepository.save(entry);
        Counter.builder("notifications.delivery")
                .tag("kind", entry.getKind())
                .tag("outcome", delivered ? "delivered" : "failed")
                .register(meterRegistry)
                .increment();
        return delivered;
    }

    private void route(NotificationOutbox entry) throws IOException {
        String target = entry.getTarget();
        if (target.startsWith("slack:")) {
            sendSlack(entry, target.substring("slack:".length()));
        } else if (target.startsWith("email:")) {
            sendEmail(entry, target.substring("email:".length()));
        } else {
            sendInApp(entry);
        }
    }

    private void sendSlack(NotificationOutbox entry, String destination) throws IOException {
        EngineProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        String webhookUrl = destination.startsWith("https://") ? destination : slack.getWebhookUrl();
        if (!slack.isEnabled() || webhookUrl == null || webhookUrl.isEmpty()) {
            log.warn("Slack not configured, delivering notification {} in-app instead", entry.getId());
            sendInApp(entry);
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("text", "*" + entry.getSubject() + "*\n" + (entry.getBody() != null ? entry.getBody() : ""));
        payload.put("username", "Incident Engine");
        if (!destination.isEmpty() && !destination.startsWith("https://")) {
            payload.put("channel", destination);
        }

        String json = objectMapper.writeValueAsString(payload);
        Request request = new Request.Builder()
                .url(webhookUrl)
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Slack webhook returned " + response.code());
            }
            log.info("Slack notification sent for incident {}", entry.getIncidentId());
        }
    }

    /**
     * Email delivery over the configured {@code spring.mail} server. Without one the notice
     * goes to connected dashboards instead. Send failures propagate so the entry is retried.
     */
    private void sendEmail(NotificationOutbox entry, String address) {
        EngineProperties.NotificationConfig.EmailConfig email = properties.getNotifications().getEmail();
        JavaMailSender sender = mailSender.getIfAvailable();
        if (!email.isEnabled() || sender == null || address.isBlank()) {
            log.warn("Email not configured, delivering notification {} in-app instead", entry.getId());
            sendInApp(entry);
            return;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setTo(address.trim());
        message.setFrom(email.getFrom());
        message.setSubject(entry.getSubject());
        message.setText(entry.getBody() != null ? entry.getBody() : "");
        message.setSentDate(Date.from(clock.instant()));
        sender.send(message);
        log.info("Email notification sent to {} for incident {}", address.trim(), entry.getIncidentId());
    }

    private void sendInApp(NotificationOutbox entry) {
        Map<String, Object> event = new HashMap<>();
        event.put("notification_id", entry.getId());
        event.put("kind", entry.getKind());
        event.put("target", entry.getTarget());
        event.put("company_id", entry.getTenantId());
        event.put("incident_id", entry.getIncidentId());
        event.put("subject", entry.getSubject());
        event.put("body", entry.getBody());
        gatewayHandler.broadcast("notification", event);
    }
}

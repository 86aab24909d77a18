package com.example.incidentengine.ingress;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.repository.AlertRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Idempotency ledger: maps (tenant, delivery id) to the alert that delivery created.
 * <p>
 * {@link #claim} is an atomic check-and-insert. Caffeine runs the loader at most once per
 * key while concurrent callers for the same key wait for its result, so two near-simultaneous
 * duplicates can never both win. Entries expire after the idempotency window on the engine
 * clock; on a miss the alert table is consulted so claims survive a restart.
 * <p>
 * A claim taken for a new alert stays in flight until the owner either {@link #confirm confirms}
 * or {@link #release releases} it. Duplicates call {@link #awaitSettled} before reporting the
 * owner's alert id, so they never point at an alert that was never stored.
 */
@Slf4j
@Component
public class DeliveryLedger {

    private final Cache<String, String> claims;
    private final AlertRepository alertRepository;
    private final Clock clock;
    private final Duration window;
    private final Duration settleTimeout;
    private final Map<String, CompletableFuture<Boolean>> inFlight = new ConcurrentHashMap<>();

    public DeliveryLedger(AlertRepository alertRepository, EngineProperties properties, Clock clock) {
        this.alertRepository = alertRepository;
        this.clock = clock;
        this.window = Duration.ofHours(properties.getIngress().getIdempotencyWindowHours());
        this.settleTimeout = Duration.ofMillis(properties.getIngress().getDuplicateWaitMs());
        this.claims = Caffeine.newBuilder()
                .maximumSize(properties.getIngress().getIdempotencyCacheSize())
                .expireAfterWrite(window)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Claim a delivery for a new alert.
     *
     * @return the claim; {@link Claim#owned()} is false when an earlier delivery already holds it
     */
    public Claim claim(String tenantId, String deliveryId, String candidateAlertId) {
        String key = key(tenantId, deliveryId);
        String owner = claims.get(key, k -> alertRepository
                .findFirstByTenantIdAndDeliveryIdAndReceivedAtGreaterThanEqualOrderByReceivedAtDesc(
                        tenantId, deliveryId, clock.instant().minus(window))
                .map(Alert::getId)
                .orElseGet(() -> {
                    inFlight.put(candidateAlertId, new CompletableFuture<>());
                    return candidateAlertId;
                }));
        return new Claim(owner, candidateAlertId.equals(owner));
    }

    /** Mark an owned claim as settled once its alert is committed. */
    public void confirm(String tenantId, String deliveryId, String alertId) {
        settle(alertId, true);
        log.debug("Confirmed delivery claim {} -> alert {} for tenant {}", deliveryId, alertId, tenantId);
    }

    /** Give a claim back when the delivery it was made for was not accepted. */
    public void release(String tenantId, String deliveryId, String alertId) {
        String key = key(tenantId, deliveryId);
        if (claims.asMap().remove(key, alertId)) {
            log.debug("Released delivery claim {} for tenant {}", deliveryId, tenantId);
        }
        settle(alertId, false);
    }

    /**
     * Wait for the owner of a claim to finish.
     *
     * @return true when {@code alertId} still holds the claim; false when the owner released it
     *         and the caller should claim again
     */
    public boolean awaitSettled(String tenantId, String deliveryId, String alertId) {
        CompletableFuture<Boolean> outcome = inFlight.get(alertId);
        if (outcome != null) {
            try {
                return outcome.get(settleTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Delivery {} for tenant {} still in flight after {} ms, treating claim as held",
                        deliveryId, tenantId, settleTimeout.toMillis());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted waiting for delivery " + deliveryId, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Delivery claim " + deliveryId + " failed", e.getCause());
            }
        }
        return alertId.equals(claims.getIfPresent(key(tenantId, deliveryId)));
    }

    private void settle(String alertId, boolean stored) {
        CompletableFuture<Boolean> outcome = inFlight.remove(alertId);
        if (outcome != null) {
            outcome.complete(stored);
        }
    }

    /**
     * Delivery id for senders that do not supply one:
     * {@code auto_} + first 16 hex chars of SHA-256("asset:signature:message").
     */
    public static String deriveDeliveryId(String assetName, String signature, String message) {
        String material = nullToEmpty(assetName) + ":" + nullToEmpty(signature) + ":" + nullToEmpty(message);
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(material.getBytes(StandardCharsets.UTF_8));
            return "auto_" + HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String key(String tenantId, String deliveryId) {
        return tenantId + '\u0000' + deliveryId;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record Claim(String alertId, boolean owned) {}
}

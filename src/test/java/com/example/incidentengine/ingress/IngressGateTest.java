package com.example.incidentengine.ingress;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Asset;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.exception.RateLimitedException;
import com.example.incidentengine.exception.UnauthorizedException;
import com.example.incidentengine.exception.ValidationException;
import com.example.incidentengine.service.TenantService;
import com.example.incidentengine.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class IngressGateTest extends EngineIntegrationTest {

    @Autowired
    private RateLimitConfigService rateLimitConfigService;

    @Autowired
    private TenantService tenantService;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    private byte[] payload(String asset, String signature, String severity, String message) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("asset_name", asset);
        body.put("signature", signature);
        body.put("severity", severity);
        body.put("message", message);
        body.put("tool_source", "zabbix");
        return objectMapper.writeValueAsBytes(body);
    }

    private static DeliveryHeaders delivery(String deliveryId) {
        return new DeliveryHeaders(null, null, deliveryId);
    }

    @Test
    void acceptedAlertIsStoredAndItsAssetDiscovered() throws Exception {
        IngressResult result = ingressGate.accept(ACME_KEY, delivery("d-" + UUID.randomUUID()),
                payload("srv1", "cpu_high", "HIGH", "CPU at 97%"));

        assertFalse(result.duplicate());
        Alert alert = alertRepository.findById(result.alertId()).orElseThrow();
        assertEquals(ACME, alert.getTenantId());
        assertEquals(Severity.HIGH, alert.getSeverity());
        assertEquals(Alert.AlertStatus.ACTIVE, alert.getStatus());
        assertEquals(clock.instant(), alert.getReceivedAt());
        assertEquals(60.0, alert.getPriorityScore());

        Asset asset = assetRepository.findByTenantIdAndName(ACME, "srv1").orElseThrow();
        assertEquals(asset.getId(), alert.getAssetId());
        assertFalse(asset.isCritical());
        assertTrue(asset.getTags().contains("zabbix"));
    }

    @Test
    void repeatedDeliveryYieldsOneAlertAndSameId() throws Exception {
        String deliveryId = "d-" + UUID.randomUUID();
        byte[] body = payload("srv1", "disk_full", "medium", "/var at 99%");

        IngressResult first = ingressGate.accept(ACME_KEY, delivery(deliveryId), body);
        for (int i = 0; i < 4; i++) {
            IngressResult again = ingressGate.accept(ACME_KEY, delivery(deliveryId), body);
            assertTrue(again.duplicate());
            assertEquals(first.alertId(), again.alertId());
        }

        assertEquals(1, alertRepository.findByTenantIdOrderByReceivedAtDesc(ACME).size());
        assertEquals(5, alertRepository.findById(first.alertId()).orElseThrow().getDeliveryAttempts());
    }

    @Test
    void concurrentDuplicatesCreateExactlyOneAlert() throws Exception {
        String deliveryId = "d-" + UUID.randomUUID();
        byte[] body = payload("srv2", "mem_high", "high", "RSS over limit");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<IngressResult>> calls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            calls.add(() -> ingressGate.accept(ACME_KEY, delivery(deliveryId), body));
        }

        Set<String> alertIds = new HashSet<>();
        int fresh = 0;
        for (Future<IngressResult> future : pool.invokeAll(calls)) {
            IngressResult result = future.get();
            alertIds.add(result.alertId());
            if (!result.duplicate()) fresh++;
        }
        pool.shutdown();

        assertEquals(1, fresh);
        assertEquals(1, alertIds.size());
        assertEquals(1, alertRepository.findByTenantIdOrderByReceivedAtDesc(ACME).size());
    }

    @Test
    void missingDeliveryIdIsDerivedFromContent() throws Exception {
        byte[] body = payload("srv3", "ping_loss", "low", "loss " + UUID.randomUUID());

        IngressResult first = ingressGate.accept(ACME_KEY, DeliveryHeaders.none(), body);
        IngressResult second = ingressGate.accept(ACME_KEY, DeliveryHeaders.none(), body);

        assertTrue(first.deliveryId().startsWith("auto_"));
        assertEquals(21, first.deliveryId().length());
        assertTrue(second.duplicate());
        assertEquals(first.alertId(), second.alertId());
    }

    @Test
    void sameDeliveryIdIsIndependentPerTenant() throws Exception {
        String deliveryId = "d-" + UUID.randomUUID();
        byte[] body = payload("srv1", "cpu_high", "high", "CPU");

        IngressResult acme = ingressGate.accept(ACME_KEY, delivery(deliveryId), body);
        IngressResult globex = ingressGate.accept("test-key-globex", delivery(deliveryId), body);

        assertFalse(globex.duplicate());
        assertNotEquals(acme.alertId(), globex.alertId());
    }

    @Test
    void unknownApiKeyIsUnauthorized() throws Exception {
        byte[] body = payload("srv1", "cpu_high", "high", "CPU");

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> ingressGate.accept("nope", delivery("d-1"), body));
        assertEquals(UnauthorizedException.Reason.UNKNOWN_KEY, e.getReason());
        assertThrows(UnauthorizedException.class, () -> ingressGate.accept(null, delivery("d-1"), body));
    }

    @Test
    void sixthDeliveryWithinTenSecondsIsRateLimited() throws Exception {
        rateLimitConfigService.update(ACME, 5, 5, true, "test");

        for (int i = 0; i < 5; i++) {
            ingressGate.accept(ACME_KEY, delivery("d-" + UUID.randomUUID()),
                    payload("srv1", "cpu_high", "high", "CPU " + i));
            clock.advance(Duration.ofSeconds(2));
        }

        RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> ingressGate.accept(ACME_KEY, delivery("d-" + UUID.randomUUID()),
                        payload("srv1", "cpu_high", "high", "CPU 6")));
        assertTrue(e.getDecision().retryAfterSeconds() > 0);
        assertEquals(5, e.getDecision().limit());
        assertEquals(5, alertRepository.findByTenantIdOrderByReceivedAtDesc(ACME).size());
    }

    @Test
    void hmacTenantRequiresValidSignature() throws Exception {
        Map<String, Object> security = tenantService.enableHmac(ACME, null, "test");
        String secret = (String) security.get("hmac_secret");
        byte[] body = payload("srv1", "cpu_high", "high", "CPU");
        String ts = String.valueOf(clock.instant().getEpochSecond());

        assertThrows(UnauthorizedException.class,
                () -> ingressGate.accept(ACME_KEY, delivery("d-" + UUID.randomUUID()), body));
        assertThrows(UnauthorizedException.class, () -> ingressGate.accept(ACME_KEY,
                new DeliveryHeaders("sha256=deadbeef", ts, "d-" + UUID.randomUUID()), body));

        String signature = signatureVerifier.sign(secret, ts, body);
        IngressResult result = ingressGate.accept(ACME_KEY,
                new DeliveryHeaders(signature, ts, "d-" + UUID.randomUUID()), body);
        assertNotNull(result.alertId());
    }

    @Test
    void invalidPayloadIsRejectedAndReleasesItsDeliveryId() throws Exception {
        String deliveryId = "d-" + UUID.randomUUID();

        assertThrows(ValidationException.class, () -> ingressGate.accept(ACME_KEY, delivery(deliveryId),
                payload("srv1", "cpu_high", "catastrophic", "CPU")));
        assertThrows(ValidationException.class, () -> ingressGate.accept(ACME_KEY, delivery(deliveryId),
                payload("srv1", null, "high", "CPU")));

        IngressResult retry = ingressGate.accept(ACME_KEY, delivery(deliveryId),
                payload("srv1", "cpu_high", "high", "CPU"));
        assertFalse(retry.duplicate());
    }

    @Test
    void malformedJsonIsAValidationError() {
        assertThrows(ValidationException.class, () -> ingressGate.accept(ACME_KEY,
                delivery("d-" + UUID.randomUUID()), "{not json".getBytes()));
        assertThrows(ValidationException.class, () -> ingressGate.accept(ACME_KEY,
                delivery("d-" + UUID.randomUUID()), new byte[0]));
    }
}

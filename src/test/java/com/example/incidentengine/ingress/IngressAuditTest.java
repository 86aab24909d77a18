package com.example.incidentengine.ingress;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.AuditLog;
import com.example.incidentengine.service.AuditService;
import com.example.incidentengine.support.EngineIntegrationTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;

class IngressAuditTest extends EngineIntegrationTest {

    @SpyBean
    private AuditService auditService;

    @AfterEach
    void restoreAudit() {
        Mockito.reset(auditService);
    }

    @Test
    void failedAuditWriteLeavesNoAlertAndRetryIsAccepted() {
        String deliveryId = "d-" + UUID.randomUUID();
        byte[] body = ("{\"asset_name\":\"srv9\",\"signature\":\"fan_failure\",\"severity\":\"high\","
                + "\"message\":\"fan 2 stopped\",\"tool_source\":\"zabbix\"}").getBytes(StandardCharsets.UTF_8);
        doThrow(new IllegalStateException("audit store down")).when(auditService)
                .log(eq("ingress"), eq("ALERT_ACCEPTED"), any(), any(), any(), anyMap());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ingressGate.accept(ACME_KEY, new DeliveryHeaders(null, null, deliveryId), body));
        assertEquals("audit store down", e.getMessage());
        assertTrue(alertRepository.findAll().stream().noneMatch(a -> deliveryId.equals(a.getDeliveryId())));

        Mockito.reset(auditService);
        IngressResult retry = ingressGate.accept(ACME_KEY, new DeliveryHeaders(null, null, deliveryId), body);

        assertFalse(retry.duplicate());
        Alert alert = alertRepository.findById(retry.alertId()).orElseThrow();
        assertEquals(1, alert.getDeliveryAttempts());
        List<AuditLog> accepted = auditService.filter(ACME, null, "ALERT_ACCEPTED", 100);
        assertEquals(1, accepted.size());
        assertEquals(alert.getId(), accepted.get(0).getTarget());
    }
}

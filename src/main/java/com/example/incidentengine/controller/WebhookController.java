package com.example.incidentengine.controller;

import com.example.incidentengine.ingress.DeliveryHeaders;
import com.example.incidentengine.ingress.IngressGate;
import com.example.incidentengine.ingress.IngressResult;
import com.example.incidentengine.ingress.RateLimitDecision;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Alert ingress endpoint for external monitoring tools.
 * The body is taken as raw bytes so the HMAC is checked against exactly what was sent.
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final IngressGate ingressGate;

    @PostMapping(value = "/alerts", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, Object>> receiveAlert(
            @RequestParam(name = "api_key", required = false) String apiKey,
            @RequestHeader(name = "X-Signature", required = false) String signature,
            @RequestHeader(name = "X-Timestamp", required = false) String timestamp,
            @RequestHeader(name = "X-Delivery-ID", required = false) String deliveryId,
            @RequestBody(required = false) byte[] body) {

        IngressResult result = ingressGate.accept(apiKey, new DeliveryHeaders(signature, timestamp, deliveryId), body);

        Map<String, Object> response = new LinkedHashMap<>();
        if (result.duplicate()) {
            response.put("duplicate", true);
        }
        response.put("alert_id", result.alertId());
        response.put("delivery_id", result.deliveryId());

        ResponseEntity.BodyBuilder ok = ResponseEntity.ok();
        RateLimitDecision rateLimit = result.rateLimit();
        if (rateLimit != null && rateLimit.isLimited()) {
            ok.header("X-RateLimit-Limit", String.valueOf(rateLimit.limit()))
              .header("X-RateLimit-Burst", String.valueOf(rateLimit.burst()))
              .header("X-RateLimit-Remaining", String.valueOf(rateLimit.remaining()));
        }
        return ok.body(response);
    }
}

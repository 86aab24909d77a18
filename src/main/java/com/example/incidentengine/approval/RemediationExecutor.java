package com.example.incidentengine.approval;

import com.example.incidentengine.config.EngineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget client for the external remediation executor. The executor reports the
 * outcome later through the remediation-status callback, so only transport failures are
 * logged here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemediationExecutor {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    public void dispatch(RemediationCommand command) {
        String url = properties.getExecutor().getUrl();
        if (url == null || url.isBlank()) {
            log.warn("No remediation executor configured, action '{}' for incident {} recorded only (execution {})",
                    command.action(), command.incidentId(), command.executionId());
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("execution_id", command.executionId());
        payload.put("incident_id", command.incidentId());
        payload.put("tenant_id", command.tenantId());
        payload.put("action", command.action());
        payload.put("risk_level", command.riskLevel().value());

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Remediation command is not serializable", e);
        }
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.error("Executor unreachable for execution {} (incident {}): {}",
                        command.executionId(), command.incidentId(), e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        log.info("Executor accepted execution {} for incident {}",
                                command.executionId(), command.incidentId());
                    } else {
                        log.error("Executor rejected execution {} for incident {}: HTTP {}",
                                command.executionId(), command.incidentId(), response.code());
                    }
                }
            }
        });
    }
}

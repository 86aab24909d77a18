package com.example.incidentengine.controller;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.repository.AlertRepository;
import com.example.incidentengine.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class AlertControllerTest extends EngineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AlertRepository alertRepository;

    @Test
    void listsAndFetchesAlerts() throws Exception {
        String asset = "web-" + UUID.randomUUID();
        String alertId = ingest(asset, "http_5xx", "high", "datadog");

        mockMvc.perform(get("/api/alerts").param("company_id", ACME).param("status", "active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(alertId))
                .andExpect(jsonPath("$[0].status").value("active"));

        mockMvc.perform(get("/api/alerts").param("company_id", ACME).param("status", "correlated"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/alerts/{id}", alertId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset_name").value(asset))
                .andExpect(jsonPath("$.tool_source").value("datadog"));
    }

    @Test
    void rejectsBadAlertQueries() throws Exception {
        mockMvc.perform(get("/api/alerts").param("company_id", ACME).param("status", "sleeping"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/alerts").param("company_id", "nope"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/alerts/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void marksDiscoveredAssetCritical() throws Exception {
        String asset = "db-" + UUID.randomUUID();
        String alertId = ingest(asset, "replication_lag", "medium", "zabbix");
        Alert alert = alertRepository.findById(alertId).orElseThrow();

        mockMvc.perform(get("/api/companies/{companyId}/assets", ACME))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.name == '" + asset + "')].critical").value(false));

        mockMvc.perform(put("/api/companies/{companyId}/assets/{assetId}", ACME, alert.getAssetId())
                        .header("X-Actor-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"critical\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.critical").value(true));

        mockMvc.perform(put("/api/companies/{companyId}/assets/{assetId}", ACME, alert.getAssetId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put("/api/companies/{companyId}/assets/{assetId}", GLOBEX, alert.getAssetId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"critical\":true}"))
                .andExpect(status().isNotFound());
    }
}

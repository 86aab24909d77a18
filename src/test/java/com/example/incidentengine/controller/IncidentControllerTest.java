package com.example.incidentengine.controller;

import com.example.incidentengine.support.EngineIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class IncidentControllerTest extends EngineIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private String correlateOne() throws Exception {
        ingest("srv1", "sigA", "critical", "zabbix");
        clock.advance(Duration.ofMinutes(1));
        ingest("srv1", "sigA", "critical", "prometheus");

        MvcResult result = mockMvc.perform(post("/api/incidents/correlate").param("company_id", ACME))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts_before").value(2))
                .andExpect(jsonPath("$.incidents_created").value(1))
                .andExpect(jsonPath("$.noise_reduction_pct").value(50.0))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .get("created_incident_ids").get(0).asText();
    }

    @Test
    void correlateThenWorkTheIncident() throws Exception {
        String incidentId = correlateOne();

        mockMvc.perform(get("/api/incidents").param("company_id", ACME).param("status", "new"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(incidentId))
                .andExpect(jsonPath("$[0].alert_count").value(2));

        mockMvc.perform(get("/api/incidents/{id}/alerts", incidentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(put("/api/incidents/{id}", incidentId)
                        .header("X-Actor-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"assigned_to\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("assigned"))
                .andExpect(jsonPath("$.assignee").value("alice"));

        mockMvc.perform(get("/api/incidents/{id}/sla-status", incidentId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_sla_met").value(true));

        mockMvc.perform(put("/api/incidents/{id}", incidentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"resolved\",\"resolution_notes\":\"disk replaced\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"));

        mockMvc.perform(put("/api/incidents/{id}", incidentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"in_progress\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void remediationApprovalOverHttp() throws Exception {
        String incidentId = correlateOne();

        MvcResult pending = mockMvc.perform(post("/api/incidents/{id}/remediations", incidentId)
                        .header("X-Actor-Id", "tina")
                        .header("X-Actor-Role", "technician")
                        .header("X-Actor-Tenant", ACME)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"failover_db\",\"risk_level\":\"high\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("pending_approval"))
                .andReturn();
        String requestId = objectMapper.readTree(pending.getResponse().getContentAsString())
                .get("request_id").asText();

        mockMvc.perform(post("/api/approval-requests/{id}/approve", requestId)
                        .header("X-Actor-Id", "ada")
                        .header("X-Actor-Role", "company_admin")
                        .header("X-Actor-Tenant", ACME))
                .andExpect(status().isForbidden());

        clock.advance(Duration.ofMinutes(61));
        mockMvc.perform(post("/api/approval-requests/{id}/approve", requestId)
                        .header("X-Actor-Id", "max")
                        .header("X-Actor-Role", "msp_admin"))
                .andExpect(status().isGone());

        mockMvc.perform(get("/api/approval-requests/{id}", requestId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("expired"));
    }

    @Test
    void companySettingsAndErrors() throws Exception {
        mockMvc.perform(get("/api/companies/{id}/sla-config", ACME))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_minutes.critical").value(30));

        mockMvc.perform(put("/api/companies/{id}/correlation-config", ACME)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"aggregation_key\":\"asset|bogus\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/companies/{id}/sla-report", ACME).param("days", "0"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/incidents/{id}", "missing"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/incidents").param("company_id", "initech"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/audit").param("company_id", ACME).param("action", "CONFIG_CHANGED"))
                .andExpect(status().isOk());
    }
}

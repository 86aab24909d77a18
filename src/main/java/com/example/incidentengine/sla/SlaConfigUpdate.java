package com.example.incidentengine.sla;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code PUT /api/companies/{id}/sla-config}. Absent fields are left unchanged.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlaConfigUpdate {
    private Boolean enabled;
    private Map<String, Integer> responseMinutes;
    private Map<String, Integer> resolutionMinutes;
    private Integer warningThresholdMinutes;
    private List<String> escalationChain;
}

package com.example.incidentengine.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of an incident. Null fields are left alone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class IncidentUpdate {
    private String assignedTo;
    private String status;
    private String resolvedBy;
    private String resolutionNotes;
}

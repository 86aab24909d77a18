package com.example.incidentengine.ingress;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of an alert delivery. Severity stays a string until validation so an
 * unknown value becomes a validation error rather than a parse failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertPayload {
    private String assetName;
    private String signature;
    private String severity;
    private String message;
    private String toolSource;
}

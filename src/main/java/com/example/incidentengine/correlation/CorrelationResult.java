package com.example.incidentengine.correlation;

import java.util.List;

/**
 * Counts from one correlation pass.
 *
 * @param alertsBefore       active alerts inside the window when the pass started
 * @param alertsAfter        incidents those alerts were folded into
 * @param duplicatesFound    alerts that joined an incident instead of opening one
 * @param noiseReductionPct  {@code (1 - alertsAfter / alertsBefore) * 100}, 0 when nothing was in the window
 */
public record CorrelationResult(
        String companyId,
        int alertsBefore,
        int alertsAfter,
        int incidentsCreated,
        int incidentsUpdated,
        int duplicatesFound,
        double noiseReductionPct,
        List<String> createdIncidentIds,
        List<String> updatedIncidentIds) {

    static double noiseReduction(int alertsBefore, int alertsAfter) {
        if (alertsBefore <= 0) return 0.0;
        double pct = (1.0 - (double) alertsAfter / alertsBefore) * 100.0;
        return Math.round(pct * 100.0) / 100.0;
    }
}

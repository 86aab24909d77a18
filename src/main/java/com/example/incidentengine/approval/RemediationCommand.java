package com.example.incidentengine.approval;

import com.example.incidentengine.domain.RiskLevel;

/**
 * What the external executor receives for one dispatched action.
 */
public record RemediationCommand(String executionId, String incidentId, String tenantId,
                                 String action, RiskLevel riskLevel) {
}

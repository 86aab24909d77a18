package com.example.incidentengine.scoring;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.Severity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic urgency score.
 *
 * <pre>
 * score = severity (critical 90, high 60, medium 30, low 10)
 *       + 20 when the asset is critical
 *       + min(2 * (members - 1), 20)
 *       + 10 when two or more tool sources reported it
 *       - min(floor(age in hours), 10)
 * </pre>
 *
 * The result never drops below zero. All arithmetic is on integers, so the same
 * inputs always give the same double.
 */
@Component
public class PriorityScorer {

    static final int CRITICAL_ASSET_BONUS = 20;
    static final int DUPLICATE_WEIGHT = 2;
    static final int DUPLICATE_CAP = 20;
    static final int MULTI_SOURCE_BONUS = 10;
    static final int AGE_DECAY_CAP = 10;

    public double score(Incident incident, Instant now) {
        return score(new ScoreInput(
                incident.getSeverity(),
                incident.isCriticalAsset(),
                incident.getAlertCount(),
                incident.getToolSources() == null ? 0 : incident.getToolSources().size(),
                incident.getCreatedAt()), now);
    }

    /** A single alert scores as a one-member group reported by one tool. */
    public double score(Alert alert, boolean criticalAsset, Instant now) {
        return score(new ScoreInput(alert.getSeverity(), criticalAsset, 1, 1, alert.getReceivedAt()), now);
    }

    public double score(ScoreInput input, Instant now) {
        long score = input.severity().score();
        if (input.criticalAsset()) {
            score += CRITICAL_ASSET_BONUS;
        }
        score += Math.min((long) DUPLICATE_WEIGHT * Math.max(input.memberCount() - 1, 0), DUPLICATE_CAP);
        if (input.distinctToolSources() >= 2) {
            score += MULTI_SOURCE_BONUS;
        }
        score -= Math.min(ageHours(input.createdAt(), now), AGE_DECAY_CAP);
        return Math.max(score, 0);
    }

    private static long ageHours(Instant createdAt, Instant now) {
        if (createdAt == null || now == null || now.isBefore(createdAt)) return 0;
        return Duration.between(createdAt, now).toHours();
    }

    public record ScoreInput(Severity severity, boolean criticalAsset, int memberCount,
                             int distinctToolSources, Instant createdAt) {
        public ScoreInput {
            if (severity == null) {
                throw new IllegalArgumentException("severity is required for scoring");
            }
        }
    }
}

package com.example.incidentengine.scoring;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Incident;
import com.example.incidentengine.domain.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final PriorityScorer scorer = new PriorityScorer();

    @Test
    void criticalIncidentOnCriticalAssetScores122() {
        Incident incident = Incident.builder()
                .severity(Severity.CRITICAL)
                .criticalAsset(true)
                .alertIds(new ArrayList<>(List.of("a1", "a2", "a3")))
                .toolSources(new LinkedHashSet<>(Set.of("zabbix", "datadog")))
                .createdAt(NOW.minus(Duration.ofHours(2)))
                .build();

        assertEquals(122.0, scorer.score(incident, NOW));
    }

    @Test
    void sameInputsGiveIdenticalScores() {
        PriorityScorer.ScoreInput input = new PriorityScorer.ScoreInput(
                Severity.HIGH, false, 7, 3, NOW.minus(Duration.ofMinutes(200)));

        double first = scorer.score(input, NOW);
        double second = scorer.score(input, NOW);

        assertEquals(first, second);
        // 60 + 12 (six extra members) + 10 (multi-source) - 3 (three full hours)
        assertEquals(79.0, first);
    }

    @Test
    void duplicateBonusAndAgeDecayAreCapped() {
        PriorityScorer.ScoreInput input = new PriorityScorer.ScoreInput(
                Severity.MEDIUM, false, 50, 1, NOW.minus(Duration.ofDays(3)));

        // 30 + 20 (capped) - 10 (capped)
        assertEquals(40.0, scorer.score(input, NOW));
    }

    @Test
    void scoreNeverDropsBelowZero() {
        PriorityScorer.ScoreInput input = new PriorityScorer.ScoreInput(
                Severity.LOW, false, 1, 1, NOW.minus(Duration.ofHours(48)));

        assertEquals(0.0, scorer.score(input, NOW));
    }

    @Test
    void singleAlertScoresAsOneMemberGroup() {
        Alert alert = Alert.builder()
                .severity(Severity.HIGH)
                .receivedAt(NOW.minus(Duration.ofMinutes(59)))
                .build();

        assertEquals(80.0, scorer.score(alert, true, NOW));
        assertEquals(60.0, scorer.score(alert, false, NOW));
    }

    @Test
    void missingSeverityIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PriorityScorer.ScoreInput(null, false, 1, 1, NOW));
    }
}

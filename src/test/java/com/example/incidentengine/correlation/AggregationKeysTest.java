package com.example.incidentengine.correlation;

import com.example.incidentengine.domain.Alert;
import com.example.incidentengine.domain.Severity;
import com.example.incidentengine.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AggregationKeysTest {

    private final Alert alert = Alert.builder()
            .assetName("srv1")
            .signature("cpu_high")
            .toolSource("zabbix")
            .severity(Severity.HIGH)
            .build();

    @Test
    void defaultPatternJoinsAssetAndSignature() {
        assertEquals("srv1|cpu_high", AggregationKeys.parse(AggregationKeys.DEFAULT_PATTERN).keyFor(alert));
    }

    @Test
    void tokensFollowPatternOrder() {
        AggregationKeys keys = AggregationKeys.parse(" Severity | tool_source |asset ");

        assertEquals("severity|tool_source|asset", keys.pattern());
        assertEquals("high|zabbix|srv1", keys.keyFor(alert));
    }

    @Test
    void unknownTokenIsRejected() {
        assertThrows(ValidationException.class, () -> AggregationKeys.parse("asset|hostname"));
    }

    @Test
    void repeatedTokenIsRejected() {
        assertThrows(ValidationException.class, () -> AggregationKeys.parse("asset|asset"));
    }

    @Test
    void blankPatternIsRejected() {
        assertThrows(ValidationException.class, () -> AggregationKeys.parse("  "));
    }

    @Test
    void categoriesComeFromSignatureKeywords() {
        assertEquals("Database", IncidentCategories.classify("mysql_replica_lag", "db01"));
        assertEquals("Network", IncidentCategories.classify("dns_timeout", "edge"));
        assertEquals("Server", IncidentCategories.classify("cpu_high", "srv1"));
        assertEquals(IncidentCategories.DEFAULT, IncidentCategories.classify("mystery", "box"));
    }
}

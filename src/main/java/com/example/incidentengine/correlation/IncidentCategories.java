package com.example.incidentengine.correlation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword classification of an incident from its signature and asset name.
 * Categories are checked in declaration order; the first hit wins.
 */
public final class IncidentCategories {

    public static final String DEFAULT = "Server";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("Network", List.of("network", "bandwidth", "latency", "connection", "dns",
                "firewall", "switch", "router", "vpn", "port"));
        KEYWORDS.put("Database", List.of("database", "sql", "mysql", "postgres", "mongodb", "db",
                "query", "table", "replica"));
        KEYWORDS.put("Security", List.of("security", "unauthorized", "breach", "intrusion",
                "vulnerability", "malware", "virus", "attack", "authentication", "ssl", "certificate"));
        KEYWORDS.put("Server", List.of("server", "cpu", "memory", "disk", "ram", "load", "process",
                "kernel", "uptime"));
        KEYWORDS.put("Application", List.of("application", "app", "service", "api", "http", "web",
                "frontend", "backend", "microservice"));
        KEYWORDS.put("Storage", List.of("storage", "volume", "filesystem", "iops", "s3", "ebs",
                "backup", "snapshot"));
        KEYWORDS.put("Cloud", List.of("cloud", "aws", "azure", "gcp", "ec2", "lambda", "kubernetes",
                "container", "docker"));
    }

    private IncidentCategories() {
    }

    public static String classify(String signature, String assetName) {
        String text = ((signature == null ? "" : signature) + " " + (assetName == null ? "" : assetName))
                .toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (text.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return DEFAULT;
    }
}

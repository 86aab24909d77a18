package com.example.incidentengine.ingress;

import com.example.incidentengine.domain.Severity;

public record SeverityAdvice(Severity severity, double confidence, String reason) {}

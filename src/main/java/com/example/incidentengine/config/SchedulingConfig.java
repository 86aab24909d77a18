package com.example.incidentengine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background loops. Tests switch it off and drive the
 * schedulers directly against a fixed clock.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(value = "incident-engine.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}

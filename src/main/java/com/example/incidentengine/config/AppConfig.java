package com.example.incidentengine.config;

import com.example.incidentengine.ingress.SeverityAdvisor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    @Bean
    public OkHttpClient okHttpClient(EngineProperties properties) {
        int timeout = properties.getExecutor().getTimeoutSeconds();
        return new OkHttpClient.Builder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .build();
    }

    /** Single time source for gates, schedulers and scoring. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** No classifier wired: every alert keeps the severity it was delivered with. */
    @Bean
    @ConditionalOnMissingBean(SeverityAdvisor.class)
    public SeverityAdvisor severityAdvisor() {
        return payload -> Optional.empty();
    }
}

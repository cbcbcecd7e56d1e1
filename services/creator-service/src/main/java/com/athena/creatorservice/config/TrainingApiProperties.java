package com.athena.creatorservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings of the external training service that new agents are registered with.
 */
@ConfigurationProperties(prefix = "training-api")
public record TrainingApiProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("https://training-service.vercel.app") String baseUrl,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("500ms") Duration waitDuration,
    @DefaultValue("3s") Duration connectTimeout,
    @DefaultValue("10s") Duration readTimeout
) {}

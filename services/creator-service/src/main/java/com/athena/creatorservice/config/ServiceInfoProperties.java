package com.athena.creatorservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "creator-service")
public record ServiceInfoProperties(
    @DefaultValue("Creator Athena Microservice") String name,
    @DefaultValue("1.0.0") String version
) {}

package com.athena.creatorservice.common.api;

import java.time.Instant;

public record ServiceStatus(
    String service,
    String status,
    String version,
    Instant timestamp
) {}

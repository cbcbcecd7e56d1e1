package com.athena.creatorservice.agent.api.dto;

import com.athena.creatorservice.agent.domain.models.AgentRole;
import com.athena.creatorservice.agent.domain.models.AgentType;
import com.athena.creatorservice.agent.domain.models.Visibility;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Agent as exposed over HTTP. The owner's public id, name and email are flattened in and are
 * {@code null} when the owning user row is missing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentResponse(
    Long id,
    Long creatorId,
    String name,
    String description,
    String avatarUrl,
    String personalityName,
    String tone,
    List<String> traitArray,
    Map<String, Object> personality,
    List<Object> courses,
    String systemPrompt,
    String model,
    Double temperature,
    Integer maxTokens,
    @JsonProperty("is_active") Boolean isActive,
    Visibility visibility,
    AgentRole role,
    AgentType agentType,
    BigDecimal priceAmount,
    String priceCurrency,
    Optional<UUID> trainingApiUuid,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt,
    String userId,
    String creatorName,
    String creatorEmail
) {}

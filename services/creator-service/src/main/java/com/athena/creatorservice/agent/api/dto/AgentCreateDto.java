package com.athena.creatorservice.agent.api.dto;

import com.athena.creatorservice.agent.domain.models.AgentRole;
import com.athena.creatorservice.agent.domain.models.AgentType;
import com.athena.creatorservice.agent.domain.models.Visibility;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentCreateDto(
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
    Boolean isActive,
    Visibility visibility,
    AgentRole role,
    AgentType agentType,
    BigDecimal priceAmount,
    String priceCurrency
) {}

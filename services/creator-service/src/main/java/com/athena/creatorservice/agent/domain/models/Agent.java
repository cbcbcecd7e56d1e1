package com.athena.creatorservice.agent.domain.models;

import com.athena.creatorservice.agent.application.AgentCommand;
import com.athena.creatorservice.common.exception.ValidationException;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
@ToString
public class Agent {
  public static final String DEFAULT_MODEL = "gpt-4";
  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final int DEFAULT_MAX_TOKENS = 2000;
  public static final String DEFAULT_CURRENCY = "USD";

  private final Long id;
  private final Long creatorId;
  private final String name;

  @ToString.Exclude
  private final String description;

  private final String avatarUrl;
  private final String personalityName;
  private final String tone;

  @ToString.Exclude
  private final List<String> traitArray;

  @ToString.Exclude
  private final Map<String, Object> personality;

  @ToString.Exclude
  private final List<Object> courses;

  @ToString.Exclude
  private final String systemPrompt;

  private final String model;
  private final Double temperature;
  private final Integer maxTokens;
  private final Boolean isActive;
  private final Visibility visibility;
  private final AgentRole role;
  private final AgentType agentType;
  private final BigDecimal priceAmount;
  private final String priceCurrency;

  @Getter(AccessLevel.NONE)
  private final UUID trainingApiUuid;

  private final OffsetDateTime createdAt;
  private final OffsetDateTime updatedAt;
  private final AgentOwner owner;

  /**
   * Builds a not yet persisted agent, filling in the defaults new agents start with.
   */
  public static Agent createAgent(AgentCommand command) {
    validate(command);
    return Agent.builder()
        .creatorId(command.creatorId())
        .name(command.name().trim())
        .description(command.description())
        .avatarUrl(command.avatarUrl())
        .personalityName(command.personalityName())
        .tone(command.tone())
        .traitArray(command.traitArray())
        .personality(command.personality())
        .courses(command.courses())
        .systemPrompt(command.systemPrompt())
        .model(orDefault(command.model(), DEFAULT_MODEL))
        .temperature(orDefault(command.temperature(), DEFAULT_TEMPERATURE))
        .maxTokens(orDefault(command.maxTokens(), DEFAULT_MAX_TOKENS))
        .isActive(orDefault(command.isActive(), Boolean.TRUE))
        .visibility(orDefault(command.visibility(), Visibility.PRIVATE))
        .role(orDefault(command.role(), AgentRole.FREE))
        .agentType(orDefault(command.agentType(), AgentType.INSTRUCTOR))
        .priceAmount(command.priceAmount())
        .priceCurrency(orDefault(command.priceCurrency(), DEFAULT_CURRENCY))
        .build();
  }

  public Optional<UUID> getTrainingApiUuid() {
    return Optional.ofNullable(trainingApiUuid);
  }

  private static void validate(AgentCommand command) {
    if (command.creatorId() == null || command.name() == null || command.name().isBlank()) {
      throw new ValidationException("creator_id and name are required");
    }
  }

  private static <T> T orDefault(T value, T fallback) {
    return value != null ? value : fallback;
  }
}

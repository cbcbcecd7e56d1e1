package com.athena.creatorservice.agent.application;

import com.athena.creatorservice.agent.domain.models.Agent;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Payload announcing a new agent to the training service. Optional attributes the creator left
 * out get the placeholders the training service expects.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrainingRegistration(
    String name,
    String description,
    String personalityName,
    String tone,
    List<String> traitArray,
    String systemPrompt,
    String model,
    Double temperature,
    Integer maxTokens
) {
  public static TrainingRegistration from(Agent agent) {
    String name = agent.getName();
    return new TrainingRegistration(
        name,
        orDefault(agent.getDescription(), "AI Agent: " + name),
        orDefault(agent.getPersonalityName(), "default"),
        orDefault(agent.getTone(), "professional"),
        agent.getTraitArray() != null ? agent.getTraitArray() : List.of(),
        orDefault(agent.getSystemPrompt(), "You are " + name + ", a helpful AI assistant."),
        agent.getModel(),
        agent.getTemperature(),
        agent.getMaxTokens());
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}

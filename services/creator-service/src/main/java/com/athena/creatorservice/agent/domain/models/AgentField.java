package com.athena.creatorservice.agent.domain.models;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Allow-list of agent attributes an owner may change after creation, keyed by their JSON name.
 * Owner, ids, correlation id and timestamps are deliberately absent.
 */
@Getter
@RequiredArgsConstructor
public enum AgentField {
  NAME("name", String.class),
  DESCRIPTION("description", String.class),
  AVATAR_URL("avatar_url", String.class),
  PERSONALITY_NAME("personality_name", String.class),
  TONE("tone", String.class),
  TRAIT_ARRAY("trait_array", List.class),
  PERSONALITY("personality", Map.class),
  COURSES("courses", List.class),
  SYSTEM_PROMPT("system_prompt", String.class),
  MODEL("model", String.class),
  TEMPERATURE("temperature", Double.class),
  MAX_TOKENS("max_tokens", Integer.class),
  IS_ACTIVE("is_active", Boolean.class),
  VISIBILITY("visibility", Visibility.class),
  ROLE("role", AgentRole.class),
  AGENT_TYPE("agent_type", AgentType.class),
  PRICE_AMOUNT("price_amount", BigDecimal.class),
  PRICE_CURRENCY("price_currency", String.class);

  private final String key;
  private final Class<?> valueType;

  public boolean isJson() {
    return this == TRAIT_ARRAY || this == PERSONALITY || this == COURSES;
  }

  public static Optional<AgentField> fromKey(String key) {
    return Arrays.stream(values())
        .filter(field -> field.key.equals(key))
        .findFirst();
  }
}

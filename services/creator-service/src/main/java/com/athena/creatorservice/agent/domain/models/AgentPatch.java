package com.athena.creatorservice.agent.domain.models;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.ToString;

/**
 * Partial update of an agent. Only allow-listed {@link AgentField}s can be carried, each with a
 * value of the field's declared type; {@code null} clears the attribute.
 */
@ToString
public final class AgentPatch {
  private final Map<AgentField, Object> values;

  private AgentPatch(Map<AgentField, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public boolean contains(AgentField field) {
    return values.containsKey(field);
  }

  public Object get(AgentField field) {
    return values.get(field);
  }

  public Map<AgentField, Object> values() {
    return values;
  }

  public static final class Builder {
    private final EnumMap<AgentField, Object> values = new EnumMap<>(AgentField.class);

    private Builder() {
    }

    public Builder set(AgentField field, Object value) {
      if (value != null && !field.getValueType().isInstance(value)) {
        throw new IllegalArgumentException(
            field.getKey() + " expects " + field.getValueType().getSimpleName()
                + " but got " + value.getClass().getSimpleName());
      }
      values.put(field, value);
      return this;
    }

    public AgentPatch build() {
      return new AgentPatch(new EnumMap<>(values));
    }
  }
}

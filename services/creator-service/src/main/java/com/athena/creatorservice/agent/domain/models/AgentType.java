package com.athena.creatorservice.agent.domain.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentType implements ValuedEnum {
  INSTRUCTOR("instructor"),
  IT_SUPPORT("it_support"),
  ADMINISTRATION("administration");

  private final String value;

  AgentType(String value) {
    this.value = value;
  }

  @JsonValue
  @Override
  public String getValue() {
    return value;
  }
}

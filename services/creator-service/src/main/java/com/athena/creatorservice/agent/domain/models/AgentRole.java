package com.athena.creatorservice.agent.domain.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentRole implements ValuedEnum {
  FREE("free"),
  PAID("paid");

  private final String value;

  AgentRole(String value) {
    this.value = value;
  }

  @JsonValue
  @Override
  public String getValue() {
    return value;
  }
}

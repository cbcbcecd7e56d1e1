package com.athena.creatorservice.agent.domain.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Visibility implements ValuedEnum {
  PRIVATE("private"),
  CAMPUS("campus"),
  PUBLIC("public");

  private final String value;

  Visibility(String value) {
    this.value = value;
  }

  @JsonValue
  @Override
  public String getValue() {
    return value;
  }
}

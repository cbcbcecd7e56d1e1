package com.athena.creatorservice.agent.infrastructure.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import lombok.RequiredArgsConstructor;
import org.jooq.JSONB;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AgentJsonHelpers {
  private final ObjectMapper objectMapper;

  public JSONB toJsonb(Object value) {
    if (value == null) {
      return null;
    }

    try {
      return JSONB.valueOf(objectMapper.writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize agent JSON column", e);
    }
  }

  public <T> T fromJsonb(JSONB jsonb, TypeReference<T> type) {
    if (jsonb == null) {
      return null;
    }

    try {
      return objectMapper.readValue(jsonb.data(), type);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Failed to read agent JSON column", e);
    }
  }
}

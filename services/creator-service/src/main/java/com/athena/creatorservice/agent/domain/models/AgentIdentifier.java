package com.athena.creatorservice.agent.domain.models;

import com.athena.creatorservice.common.exception.ValidationException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifies an agent either by its surrogate key or by the UUID the training service assigned.
 * Resolved once from the raw path segment, repositories pick the key column from the variant.
 */
public sealed interface AgentIdentifier permits AgentIdentifier.Numeric, AgentIdentifier.External {
  Pattern UUID_PATTERN = Pattern.compile(
      "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);
  Pattern NUMERIC_PATTERN = Pattern.compile("^\\d{1,18}$");

  static AgentIdentifier parse(String raw) {
    String candidate = raw == null ? "" : raw.trim();
    if (UUID_PATTERN.matcher(candidate).matches()) {
      return new External(UUID.fromString(candidate));
    }
    if (NUMERIC_PATTERN.matcher(candidate).matches()) {
      return new Numeric(Long.parseLong(candidate));
    }
    throw new ValidationException("Agent id must be a number or a UUID");
  }

  record Numeric(long value) implements AgentIdentifier {
    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  record External(UUID value) implements AgentIdentifier {
    @Override
    public String toString() {
      return value.toString();
    }
  }
}

package com.athena.creatorservice.common.api;

import com.athena.creatorservice.common.exception.ValidationException;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parses owner ids that arrive as query parameters or body members.
 */
public final class RequestIds {
  private static final Pattern DIGITS = Pattern.compile("^\\d{1,18}$");

  private RequestIds() {
  }

  public static long requireOwnerId(Object raw, String parameterName, String missingMessage) {
    if (raw == null || (raw instanceof String text && text.isBlank())) {
      throw new ValidationException(missingMessage);
    }
    return parseOwnerId(raw)
        .orElseThrow(() -> new ValidationException(parameterName + " must be a valid number"));
  }

  public static boolean isOwnerId(Object raw) {
    return parseOwnerId(raw).isPresent();
  }

  private static OptionalLong parseOwnerId(Object raw) {
    if (raw instanceof Integer || raw instanceof Long) {
      long value = ((Number) raw).longValue();
      return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
    }
    if (raw instanceof String text && DIGITS.matcher(text.trim()).matches()) {
      long value = Long.parseLong(text.trim());
      return value > 0 ? OptionalLong.of(value) : OptionalLong.empty();
    }
    return OptionalLong.empty();
  }
}

package com.athena.creatorservice.agent.domain.models;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Enum whose constants are stored and exchanged as lowercase string values.
 */
public interface ValuedEnum {
  String getValue();

  static <E extends Enum<E> & ValuedEnum> Optional<E> fromValue(Class<E> type, String value) {
    return Arrays.stream(type.getEnumConstants())
        .filter(constant -> constant.getValue().equals(value))
        .findFirst();
  }

  static <E extends Enum<E> & ValuedEnum> String allowedValues(Class<E> type) {
    return Arrays.stream(type.getEnumConstants())
        .map(ValuedEnum::getValue)
        .collect(Collectors.joining(", "));
  }
}

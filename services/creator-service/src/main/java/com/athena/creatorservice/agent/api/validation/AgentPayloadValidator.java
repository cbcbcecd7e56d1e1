package com.athena.creatorservice.agent.api.validation;

import com.athena.creatorservice.agent.domain.models.AgentRole;
import com.athena.creatorservice.agent.domain.models.AgentType;
import com.athena.creatorservice.agent.domain.models.ValuedEnum;
import com.athena.creatorservice.agent.domain.models.Visibility;
import com.athena.creatorservice.common.api.RequestIds;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks inbound agent payloads before they are mapped. Returns human readable violations, an
 * empty list meaning the payload is acceptable. Never modifies the payload.
 */
@Component
public class AgentPayloadValidator {
  private static final double MIN_TEMPERATURE = 0.0;
  private static final double MAX_TEMPERATURE = 2.0;
  private static final int MAX_TEXT_LENGTH = 255;
  private static final int MAX_MODEL_LENGTH = 100;
  // NUMERIC(10, 2)
  private static final BigDecimal PRICE_CEILING = new BigDecimal("100000000");

  public List<String> validate(Map<String, ?> payload, ValidationMode mode) {
    List<String> errors = new ArrayList<>();

    if (mode == ValidationMode.CREATE) {
      Object creatorId = payload.get("creator_id");
      if (isBlank(creatorId)) {
        errors.add("creator_id is required");
      } else if (!RequestIds.isOwnerId(creatorId)) {
        errors.add("creator_id must be a valid number");
      }
      if (isBlank(payload.get("name"))) {
        errors.add("name is required");
      } else if (!(payload.get("name") instanceof String)) {
        errors.add("name must be a non-empty string");
      }
    } else if (payload.containsKey("name")
        && (isBlank(payload.get("name")) || !(payload.get("name") instanceof String))) {
      errors.add("name must be a non-empty string");
    }

    checkLength(payload, "name", MAX_TEXT_LENGTH, errors);
    checkLength(payload, "personality_name", MAX_TEXT_LENGTH, errors);
    checkLength(payload, "tone", MAX_TEXT_LENGTH, errors);

    checkEnum(payload, mode, "visibility", Visibility.class, errors);
    checkEnum(payload, mode, "role", AgentRole.class, errors);
    checkEnum(payload, mode, "agent_type", AgentType.class, errors);

    if (isChecked(payload, mode, "temperature") && !isTemperature(payload.get("temperature"))) {
      errors.add("temperature must be a number between 0 and 2");
    }
    if (isChecked(payload, mode, "max_tokens") && !isPositiveInteger(payload.get("max_tokens"))) {
      errors.add("max_tokens must be a positive integer");
    }
    if (isChecked(payload, mode, "model") && !isNonBlankString(payload.get("model"))) {
      errors.add("model must be a string");
    }
    checkLength(payload, "model", MAX_MODEL_LENGTH, errors);
    if (isChecked(payload, mode, "is_active") && !(payload.get("is_active") instanceof Boolean)) {
      errors.add("is_active must be a boolean");
    }

    Object traits = payload.get("trait_array");
    if (traits != null && !(traits instanceof Collection<?> list
        && list.stream().allMatch(String.class::isInstance))) {
      errors.add("trait_array must be an array of strings");
    }
    Object courses = payload.get("courses");
    if (courses != null && !(courses instanceof Collection<?>)) {
      errors.add("courses must be an array");
    }
    Object personality = payload.get("personality");
    if (personality != null && !(personality instanceof Map<?, ?>)) {
      errors.add("personality must be an object");
    }
    Object priceAmount = payload.get("price_amount");
    if (priceAmount != null && !isNonNegativeNumber(priceAmount)) {
      errors.add("price_amount must be a non-negative number");
    } else if (priceAmount != null && !isBelowPriceCeiling((Number) priceAmount)) {
      errors.add("price_amount must be below " + PRICE_CEILING.toPlainString());
    }
    Object priceCurrency = payload.get("price_currency");
    if (priceCurrency != null
        && !(priceCurrency instanceof String currency && currency.matches("[A-Za-z]{3}"))) {
      errors.add("price_currency must be a 3-letter currency code");
    }

    return errors;
  }

  private static <E extends Enum<E> & ValuedEnum> void checkEnum(
      Map<String, ?> payload, ValidationMode mode, String key, Class<E> type, List<String> errors) {
    if (!isChecked(payload, mode, key)) {
      return;
    }
    Object value = payload.get(key);
    boolean known = value instanceof String text && ValuedEnum.fromValue(type, text).isPresent();
    if (!known) {
      errors.add(key + " must be one of: " + ValuedEnum.allowedValues(type));
    }
  }

  private static void checkLength(
      Map<String, ?> payload, String key, int maxLength, List<String> errors) {
    if (payload.get(key) instanceof String text && text.length() > maxLength) {
      errors.add(key + " must be at most " + maxLength + " characters");
    }
  }

  // on create an explicit null means "use the default", on update it would clear a NOT NULL column
  private static boolean isChecked(Map<String, ?> payload, ValidationMode mode, String key) {
    return mode == ValidationMode.UPDATE ? payload.containsKey(key) : payload.get(key) != null;
  }

  private static boolean isBlank(Object value) {
    return value == null || (value instanceof String text && text.isBlank());
  }

  private static boolean isNonBlankString(Object value) {
    return value instanceof String text && !text.isBlank();
  }

  private static boolean isTemperature(Object value) {
    if (!(value instanceof Number number)) {
      return false;
    }
    double temperature = number.doubleValue();
    return temperature >= MIN_TEMPERATURE && temperature <= MAX_TEMPERATURE;
  }

  private static boolean isPositiveInteger(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      long tokens = ((Number) value).longValue();
      return tokens > 0 && tokens <= Integer.MAX_VALUE;
    }
    return false;
  }

  private static boolean isBelowPriceCeiling(Number value) {
    BigDecimal amount = value instanceof BigDecimal decimal
        ? decimal
        : new BigDecimal(value.toString());
    return amount.setScale(2, RoundingMode.HALF_UP).compareTo(PRICE_CEILING) < 0;
  }

  private static boolean isNonNegativeNumber(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal.signum() >= 0;
    }
    return value instanceof Number number && number.doubleValue() >= 0;
  }
}

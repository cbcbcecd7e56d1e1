package com.athena.creatorservice.agent.api.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AgentPayloadValidatorTest {
  private final AgentPayloadValidator validator = new AgentPayloadValidator();

  @Test
  void acceptsMinimalCreatePayload() {
    List<String> errors = validator.validate(
        Map.of("creator_id", 1, "name", "Bot"), ValidationMode.CREATE);

    assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
  }

  @Test
  void reportsEveryMissingMandatoryMemberOnCreate() {
    List<String> errors = validator.validate(Map.of("description", "x"), ValidationMode.CREATE);

    assertEquals(List.of("creator_id is required", "name is required"), errors);
  }

  @Test
  void blankNameCountsAsMissing() {
    List<String> errors = validator.validate(
        Map.of("creator_id", "7", "name", "   "), ValidationMode.CREATE);

    assertEquals(List.of("name is required"), errors);
  }

  @Test
  void rejectsNonNumericCreatorId() {
    List<String> errors = validator.validate(
        Map.of("creator_id", "abc", "name", "Bot"), ValidationMode.CREATE);

    assertEquals(List.of("creator_id must be a valid number"), errors);
  }

  @Test
  void rejectsValuesOutsideEnumeratedSets() {
    Map<String, Object> payload = Map.of(
        "creator_id", 1, "name", "Bot",
        "visibility", "secret", "role", "premium", "agent_type", "janitor");

    List<String> errors = validator.validate(payload, ValidationMode.CREATE);

    assertEquals(List.of(
        "visibility must be one of: private, campus, public",
        "role must be one of: free, paid",
        "agent_type must be one of: instructor, it_support, administration"), errors);
  }

  @Test
  void acceptsTemperatureBoundsAndRejectsOutsideThem() {
    assertTrue(validator.validate(Map.of("temperature", 0), ValidationMode.UPDATE).isEmpty());
    assertTrue(validator.validate(Map.of("temperature", 2.0), ValidationMode.UPDATE).isEmpty());

    assertEquals(List.of("temperature must be a number between 0 and 2"),
        validator.validate(Map.of("temperature", 2.01), ValidationMode.UPDATE));
    assertEquals(List.of("temperature must be a number between 0 and 2"),
        validator.validate(Map.of("temperature", "hot"), ValidationMode.UPDATE));
  }

  @Test
  void updateModeDoesNotRequireMandatoryMembers() {
    List<String> errors = validator.validate(
        Map.of("description", "new text"), ValidationMode.UPDATE);

    assertTrue(errors.isEmpty());
  }

  @Test
  void updateModeRejectsExplicitNullForNotNullColumns() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("visibility", null);
    payload.put("temperature", null);
    payload.put("description", null);

    List<String> errors = validator.validate(payload, ValidationMode.UPDATE);

    assertEquals(List.of(
        "visibility must be one of: private, campus, public",
        "temperature must be a number between 0 and 2"), errors);
  }

  @Test
  void createModeTreatsNullOptionalMembersAsDefaults() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("creator_id", 1);
    payload.put("name", "Bot");
    payload.put("visibility", null);
    payload.put("temperature", null);

    assertTrue(validator.validate(payload, ValidationMode.CREATE).isEmpty());
  }

  @Test
  void checksJsonShapedMembers() {
    Map<String, Object> payload = Map.of(
        "trait_array", List.of("curious", 3),
        "courses", "CS101",
        "personality", List.of("warm"));

    List<String> errors = validator.validate(payload, ValidationMode.UPDATE);

    assertEquals(List.of(
        "trait_array must be an array of strings",
        "courses must be an array",
        "personality must be an object"), errors);
  }

  @Test
  void checksNumericAndMonetaryMembers() {
    Map<String, Object> payload = Map.of(
        "max_tokens", 0,
        "price_amount", -5,
        "price_currency", "dollars",
        "is_active", "yes");

    List<String> errors = validator.validate(payload, ValidationMode.UPDATE);

    assertEquals(List.of(
        "max_tokens must be a positive integer",
        "is_active must be a boolean",
        "price_amount must be a non-negative number",
        "price_currency must be a 3-letter currency code"), errors);
  }

  @Test
  void neverModifiesThePayload() {
    Map<String, Object> payload = new HashMap<>(Map.of("creator_id", 1, "name", "Bot", "x", 1));
    Map<String, Object> copy = new HashMap<>(payload);

    validator.validate(payload, ValidationMode.CREATE);

    assertEquals(copy, payload);
  }

  @Test
  void rejectsTextLongerThanItsColumn() {
    Map<String, Object> payload = Map.of(
        "name", "x".repeat(300),
        "personality_name", "p".repeat(256),
        "tone", "t".repeat(255),
        "model", "m".repeat(150));

    List<String> errors = validator.validate(payload, ValidationMode.UPDATE);

    assertEquals(List.of(
        "name must be at most 255 characters",
        "personality_name must be at most 255 characters",
        "model must be at most 100 characters"), errors);
  }

  @Test
  void rejectsOverlongNameOnCreate() {
    List<String> errors = validator.validate(
        Map.of("creator_id", 1, "name", "x".repeat(256)), ValidationMode.CREATE);

    assertEquals(List.of("name must be at most 255 characters"), errors);
  }

  @Test
  void rejectsPriceThatDoesNotFitTheColumn() {
    assertEquals(List.of("price_amount must be below 100000000"),
        validator.validate(Map.of("price_amount", 1.0e12), ValidationMode.UPDATE));
    assertEquals(List.of("price_amount must be below 100000000"),
        validator.validate(Map.of("price_amount", 99999999.999), ValidationMode.UPDATE));
    assertTrue(validator.validate(Map.of("price_amount", 99999999.99), ValidationMode.UPDATE)
        .isEmpty());
  }
}

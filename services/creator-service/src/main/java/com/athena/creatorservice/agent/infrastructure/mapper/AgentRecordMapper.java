package com.athena.creatorservice.agent.infrastructure.mapper;

import static com.athena.creatorservice.jooq.Tables.AGENTS;
import static com.athena.creatorservice.jooq.Tables.USERS;

import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentField;
import com.athena.creatorservice.agent.domain.models.AgentOwner;
import com.athena.creatorservice.agent.domain.models.AgentPatch;
import com.athena.creatorservice.agent.domain.models.AgentRole;
import com.athena.creatorservice.agent.domain.models.AgentType;
import com.athena.creatorservice.agent.domain.models.ValuedEnum;
import com.athena.creatorservice.agent.domain.models.Visibility;
import com.athena.creatorservice.jooq.tables.records.AgentsRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.JSONB;
import org.jooq.Record;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.springframework.beans.factory.annotation.Autowired;

@Mapper(componentModel = "spring")
public abstract class AgentRecordMapper {
  public static final Field<String> CREATOR_NAME = USERS.NAME.as("creator_name");
  public static final Field<String> CREATOR_EMAIL = USERS.EMAIL.as("creator_email");

  private static final TypeReference<List<String>> TRAITS = new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> PERSONALITY_OBJECT =
      new TypeReference<>() {};
  private static final TypeReference<List<Object>> COURSE_LIST = new TypeReference<>() {};

  private static final Map<AgentField, Field<?>> MUTABLE_COLUMNS = mutableColumns();

  @Autowired
  protected AgentJsonHelpers jsonHelpers;

  @Mapping(target = "id", ignore = true)
  @Mapping(target = "createdAt", ignore = true)
  @Mapping(target = "updatedAt", ignore = true)
  @Mapping(target = "traitArray", qualifiedByName = "json")
  @Mapping(target = "personality", qualifiedByName = "json")
  @Mapping(target = "courses", qualifiedByName = "json")
  public abstract AgentsRecord toRecord(Agent agent);

  public Agent toDomain(AgentsRecord record) {
    if (record == null) {
      return null;
    }

    return Agent.builder()
        .id(record.getId())
        .creatorId(record.getCreatorId())
        .name(record.getName())
        .description(record.getDescription())
        .avatarUrl(record.getAvatarUrl())
        .personalityName(record.getPersonalityName())
        .tone(record.getTone())
        .traitArray(jsonHelpers.fromJsonb(record.getTraitArray(), TRAITS))
        .personality(jsonHelpers.fromJsonb(record.getPersonality(), PERSONALITY_OBJECT))
        .courses(jsonHelpers.fromJsonb(record.getCourses(), COURSE_LIST))
        .systemPrompt(record.getSystemPrompt())
        .model(record.getModel())
        .temperature(record.getTemperature())
        .maxTokens(record.getMaxTokens())
        .isActive(record.getIsActive())
        .visibility(map(Visibility.class, record.getVisibility()))
        .role(map(AgentRole.class, record.getRole()))
        .agentType(map(AgentType.class, record.getAgentType()))
        .priceAmount(record.getPriceAmount())
        .priceCurrency(record.getPriceCurrency())
        .trainingApiUuid(record.getTrainingApiUuid())
        .createdAt(record.getCreatedAt())
        .updatedAt(record.getUpdatedAt())
        .build();
  }

  public Agent toDomainWithOwner(Record record) {
    Agent agent = toDomain(record.into(AGENTS));
    String ownerUserId = record.get(USERS.USER_ID);
    String ownerName = record.get(CREATOR_NAME);
    String ownerEmail = record.get(CREATOR_EMAIL);
    if (ownerUserId == null && ownerName == null && ownerEmail == null) {
      return agent;
    }
    return agent.toBuilder()
        .owner(new AgentOwner(ownerUserId, ownerName, ownerEmail))
        .build();
  }

  /**
   * Record holding only the patched columns as changed, so an UPDATE built from it leaves every
   * other column alone.
   */
  public AgentsRecord toChangedRecord(AgentPatch patch) {
    AgentsRecord record = new AgentsRecord();
    patch.values().forEach((agentField, value) ->
        put(record, MUTABLE_COLUMNS.get(agentField), toColumnValue(agentField, value)));
    return record;
  }

  @Named("json")
  protected JSONB json(Object value) {
    return jsonHelpers.toJsonb(value);
  }

  protected String value(ValuedEnum value) {
    return value == null ? null : value.getValue();
  }

  protected UUID unwrap(Optional<UUID> value) {
    return value == null ? null : value.orElse(null);
  }

  private Object toColumnValue(AgentField agentField, Object value) {
    if (value == null) {
      return null;
    }
    if (agentField.isJson()) {
      return jsonHelpers.toJsonb(value);
    }
    if (value instanceof ValuedEnum valuedEnum) {
      return valuedEnum.getValue();
    }
    return value;
  }

  private static <T> void put(AgentsRecord record, Field<T> column, Object value) {
    record.set(column, column.getDataType().convert(value));
  }

  private static <E extends Enum<E> & ValuedEnum> E map(Class<E> type, String value) {
    if (value == null) {
      return null;
    }
    return ValuedEnum.fromValue(type, value)
        .orElseThrow(() -> new IllegalStateException(
            "Unknown " + type.getSimpleName() + " stored for agent: " + value));
  }

  private static Map<AgentField, Field<?>> mutableColumns() {
    Map<AgentField, Field<?>> columns = new EnumMap<>(AgentField.class);
    columns.put(AgentField.NAME, AGENTS.NAME);
    columns.put(AgentField.DESCRIPTION, AGENTS.DESCRIPTION);
    columns.put(AgentField.AVATAR_URL, AGENTS.AVATAR_URL);
    columns.put(AgentField.PERSONALITY_NAME, AGENTS.PERSONALITY_NAME);
    columns.put(AgentField.TONE, AGENTS.TONE);
    columns.put(AgentField.TRAIT_ARRAY, AGENTS.TRAIT_ARRAY);
    columns.put(AgentField.PERSONALITY, AGENTS.PERSONALITY);
    columns.put(AgentField.COURSES, AGENTS.COURSES);
    columns.put(AgentField.SYSTEM_PROMPT, AGENTS.SYSTEM_PROMPT);
    columns.put(AgentField.MODEL, AGENTS.MODEL);
    columns.put(AgentField.TEMPERATURE, AGENTS.TEMPERATURE);
    columns.put(AgentField.MAX_TOKENS, AGENTS.MAX_TOKENS);
    columns.put(AgentField.IS_ACTIVE, AGENTS.IS_ACTIVE);
    columns.put(AgentField.VISIBILITY, AGENTS.VISIBILITY);
    columns.put(AgentField.ROLE, AGENTS.ROLE);
    columns.put(AgentField.AGENT_TYPE, AGENTS.AGENT_TYPE);
    columns.put(AgentField.PRICE_AMOUNT, AGENTS.PRICE_AMOUNT);
    columns.put(AgentField.PRICE_CURRENCY, AGENTS.PRICE_CURRENCY);
    if (columns.size() != AgentField.values().length) {
      throw new IllegalStateException("Every mutable agent field needs a column");
    }
    return columns;
  }
}

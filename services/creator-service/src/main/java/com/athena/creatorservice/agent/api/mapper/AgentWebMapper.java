package com.athena.creatorservice.agent.api.mapper;

import com.athena.creatorservice.agent.api.dto.AgentCreateDto;
import com.athena.creatorservice.agent.api.dto.AgentResponse;
import com.athena.creatorservice.agent.application.AgentCommand;
import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentField;
import com.athena.creatorservice.agent.domain.models.AgentPatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.springframework.beans.factory.annotation.Autowired;

@Mapper(componentModel = "spring")
public abstract class AgentWebMapper {
  @Autowired
  protected ObjectMapper objectMapper;

  public abstract AgentCommand toCommand(AgentCreateDto dto);

  @Mapping(target = "userId", source = "owner.userId")
  @Mapping(target = "creatorName", source = "owner.name")
  @Mapping(target = "creatorEmail", source = "owner.email")
  public abstract AgentResponse toResponse(Agent agent);

  public abstract List<AgentResponse> toResponses(List<Agent> agents);

  /**
   * Reads a creation payload that already passed validation.
   */
  public AgentCreateDto toCreateDto(Map<String, Object> payload) {
    return objectMapper.convertValue(payload, AgentCreateDto.class);
  }

  /**
   * Keeps the allow-listed members of an update payload, converted to the field types.
   * Unknown members are dropped.
   */
  public AgentPatch toPatch(Map<String, Object> payload) {
    AgentPatch.Builder patch = AgentPatch.builder();
    payload.forEach((key, value) -> AgentField.fromKey(key)
        .ifPresent(field -> patch.set(field, convert(field, value))));
    return patch.build();
  }

  private Object convert(AgentField field, Object value) {
    if (field == AgentField.NAME && value instanceof String name) {
      return name.trim();
    }
    return value == null ? null : objectMapper.convertValue(value, field.getValueType());
  }
}

package com.athena.creatorservice.agent.api.controller;

import com.athena.creatorservice.agent.api.dto.AgentResponse;
import com.athena.creatorservice.agent.api.mapper.AgentWebMapper;
import com.athena.creatorservice.agent.api.validation.AgentPayloadValidator;
import com.athena.creatorservice.agent.api.validation.ValidationMode;
import com.athena.creatorservice.agent.application.AgentCommand;
import com.athena.creatorservice.agent.application.AgentUsecase;
import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentIdentifier;
import com.athena.creatorservice.agent.domain.models.AgentPatch;
import com.athena.creatorservice.common.api.RequestIds;
import com.athena.creatorservice.common.dto.ApiResponse;
import com.athena.creatorservice.common.dto.DeletedResource;
import com.athena.creatorservice.common.exception.ValidationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RequestMapping("/creator/agents")
@RestController
public class AgentController {
  private static final String CREATOR_ID = "creator_id";
  private static final String MISSING_QUERY_CREATOR_ID = "creator_id query parameter is required";
  private static final String MISSING_BODY_CREATOR_ID = "creator_id is required in request body";

  private final AgentPayloadValidator validator;
  private final AgentWebMapper mapper;
  private final AgentUsecase agentUsecase;

  @PostMapping
  public ResponseEntity<ApiResponse<AgentResponse>> createAgent(
      @RequestBody Map<String, Object> payload) {
    requireValid(payload, ValidationMode.CREATE);
    AgentCommand command = mapper.toCommand(mapper.toCreateDto(payload));
    Agent agent = agentUsecase.registerAgent(command);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.ok("Agent created successfully", mapper.toResponse(agent)));
  }

  @GetMapping
  public ApiResponse<List<AgentResponse>> getCreatorAgents(
      @RequestParam(name = CREATOR_ID, required = false) String creatorId) {
    long ownerId = RequestIds.requireOwnerId(creatorId, CREATOR_ID, MISSING_QUERY_CREATOR_ID);
    List<Agent> agents = agentUsecase.findAgentsByCreator(ownerId);
    return ApiResponse.list("Agents retrieved successfully", mapper.toResponses(agents));
  }

  @GetMapping("/{agentId}")
  public ApiResponse<AgentResponse> getAgent(
      @PathVariable("agentId") String agentId,
      @RequestParam(name = CREATOR_ID, required = false) String creatorId) {
    long ownerId = RequestIds.requireOwnerId(creatorId, CREATOR_ID, MISSING_QUERY_CREATOR_ID);
    Agent agent = agentUsecase.findAgent(AgentIdentifier.parse(agentId), ownerId);
    return ApiResponse.ok("Agent retrieved successfully", mapper.toResponse(agent));
  }

  @PutMapping("/{agentId}")
  public ApiResponse<AgentResponse> updateAgent(
      @PathVariable("agentId") String agentId, @RequestBody Map<String, Object> payload) {
    Map<String, Object> updates = new LinkedHashMap<>(payload);
    long ownerId = RequestIds.requireOwnerId(
        updates.remove(CREATOR_ID), CREATOR_ID, MISSING_BODY_CREATOR_ID);
    requireValid(updates, ValidationMode.UPDATE);

    AgentPatch patch = mapper.toPatch(updates);
    Agent agent = agentUsecase.updateAgent(AgentIdentifier.parse(agentId), ownerId, patch);
    return ApiResponse.ok("Agent updated successfully", mapper.toResponse(agent));
  }

  @DeleteMapping("/{agentId}")
  public ApiResponse<DeletedResource> deleteAgent(
      @PathVariable("agentId") String agentId,
      @RequestParam(name = CREATOR_ID, required = false) String creatorId) {
    long ownerId = RequestIds.requireOwnerId(creatorId, CREATOR_ID, MISSING_QUERY_CREATOR_ID);
    long deletedId = agentUsecase.removeAgent(AgentIdentifier.parse(agentId), ownerId);
    return ApiResponse.ok("Agent deleted successfully", new DeletedResource(deletedId));
  }

  private void requireValid(Map<String, Object> payload, ValidationMode mode) {
    List<String> errors = validator.validate(payload, mode);
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
  }
}

package com.athena.creatorservice.agent.application;

import com.athena.creatorservice.agent.domain.AgentNotFoundException;
import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentIdentifier;
import com.athena.creatorservice.agent.domain.models.AgentPatch;
import com.athena.creatorservice.agent.domain.models.AgentRepository;
import com.athena.creatorservice.common.exception.ValidationException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AgentUsecase {
  private final AgentRepository agentRepository;
  private final AgentTrainingRegistrar trainingRegistrar;

  public Agent registerAgent(AgentCommand command) {
    Agent agent = agentRepository.save(Agent.createAgent(command));
    log.info("Agent {} created for creator {}", agent.getId(), agent.getCreatorId());
    trainingRegistrar.register(agent);
    return agent;
  }

  public List<Agent> findAgentsByCreator(long creatorId) {
    return agentRepository.findByCreatorId(creatorId);
  }

  public Agent findAgent(AgentIdentifier agentId, long creatorId) {
    return agentRepository.findByIdAndCreatorId(agentId, creatorId)
        .orElseThrow(AgentNotFoundException::new);
  }

  public Agent updateAgent(AgentIdentifier agentId, long creatorId, AgentPatch patch) {
    if (patch.isEmpty()) {
      throw new ValidationException("No valid fields to update");
    }

    Agent agent = agentRepository.update(agentId, creatorId, patch)
        .orElseThrow(AgentNotFoundException::new);
    log.info("Agent {} updated by creator {}: {}", agent.getId(), creatorId, patch.values().keySet());
    return agent;
  }

  public long removeAgent(AgentIdentifier agentId, long creatorId) {
    long deletedId = agentRepository.delete(agentId, creatorId)
        .orElseThrow(AgentNotFoundException::new);
    log.info("Agent {} deleted by creator {}", deletedId, creatorId);
    return deletedId;
  }
}

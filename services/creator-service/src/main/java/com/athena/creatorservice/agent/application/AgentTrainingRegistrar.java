package com.athena.creatorservice.agent.application;

import com.athena.creatorservice.agent.application.port.TrainingApiClient;
import com.athena.creatorservice.agent.application.port.TrainingApiException;
import com.athena.creatorservice.agent.domain.models.Agent;
import com.athena.creatorservice.agent.domain.models.AgentRepository;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Registers freshly created agents with the training service off the request thread. Failures
 * are logged and dropped; the agent simply keeps an empty training correlation id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentTrainingRegistrar {
  public static final String EXECUTOR = "trainingExecutor";

  private final TrainingApiClient trainingApiClient;
  private final AgentRepository agentRepository;

  @Async(EXECUTOR)
  public void register(Agent agent) {
    if (!trainingApiClient.isEnabled()) {
      log.debug("Training API disabled, agent {} stays unregistered", agent.getId());
      return;
    }

    Optional<UUID> trainingApiUuid;
    try {
      trainingApiUuid = trainingApiClient.registerAgent(TrainingRegistration.from(agent));
    } catch (TrainingApiException e) {
      log.warn("Failed to register agent {} with Training API: {}", agent.getId(), e.getMessage());
      return;
    }

    trainingApiUuid.ifPresentOrElse(
        uuid -> attach(agent, uuid),
        () -> log.warn("Training API returned no agent_id for agent {}", agent.getId()));
  }

  private void attach(Agent agent, UUID uuid) {
    try {
      agentRepository.attachTrainingId(agent.getId(), uuid);
    } catch (DataAccessException | org.jooq.exception.DataAccessException e) {
      log.warn("Failed to store training id {} for agent {}: {}", uuid, agent.getId(),
          e.getMessage());
      return;
    }
    log.info("Agent {} registered with Training API as {}", agent.getId(), uuid);
  }
}

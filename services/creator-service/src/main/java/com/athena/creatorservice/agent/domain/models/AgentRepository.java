package com.athena.creatorservice.agent.domain.models;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AgentRepository {
  Agent save(Agent agent);

  List<Agent> findByCreatorId(long creatorId);

  Optional<Agent> findByIdAndCreatorId(AgentIdentifier agentId, long creatorId);

  /**
   * Applies the patch only when the agent belongs to the creator.
   *
   * @return the updated agent, empty when no row matched id and owner
   */
  Optional<Agent> update(AgentIdentifier agentId, long creatorId, AgentPatch patch);

  /**
   * @return surrogate id of the deleted row, empty when no row matched id and owner
   */
  Optional<Long> delete(AgentIdentifier agentId, long creatorId);

  void attachTrainingId(long agentId, UUID trainingApiUuid);
}

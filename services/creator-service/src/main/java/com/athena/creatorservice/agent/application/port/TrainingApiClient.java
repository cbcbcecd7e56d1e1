package com.athena.creatorservice.agent.application.port;

import com.athena.creatorservice.agent.application.TrainingRegistration;
import java.util.Optional;
import java.util.UUID;

public interface TrainingApiClient {
  boolean isEnabled();

  /**
   * Registers an agent with the training service.
   *
   * @return the UUID the training service assigned, empty when its answer carried none
   * @throws TrainingApiException when the service could not be reached or refused the call
   */
  Optional<UUID> registerAgent(TrainingRegistration registration);
}

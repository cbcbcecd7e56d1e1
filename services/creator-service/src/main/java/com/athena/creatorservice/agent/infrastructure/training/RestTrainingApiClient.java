package com.athena.creatorservice.agent.infrastructure.training;

import com.athena.creatorservice.agent.application.TrainingRegistration;
import com.athena.creatorservice.agent.application.port.TrainingApiClient;
import com.athena.creatorservice.agent.application.port.TrainingApiException;
import com.athena.creatorservice.config.TrainingApiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
@Component
public class RestTrainingApiClient implements TrainingApiClient {
  static final String REGISTER_AGENT_PATH = "/api/agents";

  private final RestClient trainingRestClient;
  private final TrainingApiProperties properties;
  private final Retry retry;

  public RestTrainingApiClient(RestClient trainingRestClient, TrainingApiProperties properties) {
    this.trainingRestClient = trainingRestClient;
    this.properties = properties;
    this.retry = Retry.of("training-api", RetryConfig.custom()
        .maxAttempts(Math.max(1, properties.maxAttempts()))
        .waitDuration(properties.waitDuration())
        .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
        .build());
    this.retry.getEventPublisher().onRetry(event -> log.debug(
        "Retrying Training API call, attempt {}: {}",
        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
  }

  @Override
  public boolean isEnabled() {
    return properties.enabled();
  }

  @Override
  public Optional<UUID> registerAgent(TrainingRegistration registration) {
    log.debug("Registering agent '{}' with Training API at {}{}",
        registration.name(), properties.baseUrl(), REGISTER_AGENT_PATH);
    try {
      JsonNode response = retry.executeSupplier(() -> post(registration));
      return extractAgentId(response);
    } catch (RestClientException e) {
      throw new TrainingApiException("Training API registration failed: " + e.getMessage(), e);
    }
  }

  private JsonNode post(TrainingRegistration registration) {
    return trainingRestClient.post()
        .uri(REGISTER_AGENT_PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .body(registration)
        .retrieve()
        .body(JsonNode.class);
  }

  // the id sits under data.agent_id, older deployments answer with a top-level agent_id
  private Optional<UUID> extractAgentId(JsonNode response) {
    if (response == null) {
      return Optional.empty();
    }
    JsonNode agentId = response.path("data").path("agent_id");
    if (!agentId.isTextual()) {
      agentId = response.path("agent_id");
    }
    if (!agentId.isTextual()) {
      return Optional.empty();
    }

    try {
      return Optional.of(UUID.fromString(agentId.asText()));
    } catch (IllegalArgumentException e) {
      log.warn("Training API returned a malformed agent_id: {}", agentId.asText());
      return Optional.empty();
    }
  }
}

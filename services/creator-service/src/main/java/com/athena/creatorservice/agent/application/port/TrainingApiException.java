package com.athena.creatorservice.agent.application.port;

public class TrainingApiException extends RuntimeException {
  public TrainingApiException(String message, Throwable cause) {
    super(message, cause);
  }
}

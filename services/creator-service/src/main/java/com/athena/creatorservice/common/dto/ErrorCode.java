package com.athena.creatorservice.common.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
  INTERNAL_ERROR("C-1000", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),

  VALIDATION_FAILED("C-V1001", "Validation failed", HttpStatus.BAD_REQUEST),
  MALFORMED_REQUEST("C-V1002", "Malformed request body", HttpStatus.BAD_REQUEST),

  AGENT_NOT_FOUND("C-A1001", "Agent not found or access denied", HttpStatus.NOT_FOUND),
  VOICE_NOT_FOUND("C-VC1001", "Voice not found for this user", HttpStatus.NOT_FOUND),

  REFERENCED_ROW_MISSING("C-D1001", "Referenced row does not exist", HttpStatus.CONFLICT),
  CONSTRAINT_VIOLATED("C-D1002", "Value rejected by storage constraint", HttpStatus.CONFLICT);

  private final String value;
  private final String description;
  private final HttpStatus status;
}

package com.athena.creatorservice.common.exception;

import com.athena.creatorservice.common.dto.ErrorCode;
import lombok.Getter;

/**
 * Base of every failure the service reports to callers on purpose. The {@link ErrorCode}
 * decides the HTTP status, the message is what the caller sees.
 */
@Getter
public abstract class CreatorServiceException extends RuntimeException {
  private final ErrorCode errorCode;

  protected CreatorServiceException(ErrorCode errorCode) {
    this(errorCode, errorCode.getDescription());
  }

  protected CreatorServiceException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  protected CreatorServiceException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}

package com.athena.creatorservice.common.exception;

import com.athena.creatorservice.common.dto.ErrorCode;
import java.util.List;
import lombok.Getter;

@Getter
public class ValidationException extends CreatorServiceException {
  private final List<String> errors;

  public ValidationException(String message) {
    super(ErrorCode.VALIDATION_FAILED, message);
    this.errors = List.of();
  }

  public ValidationException(List<String> errors) {
    super(ErrorCode.VALIDATION_FAILED);
    this.errors = List.copyOf(errors);
  }
}

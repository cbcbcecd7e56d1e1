package com.athena.creatorservice.common.exception;

import com.athena.creatorservice.common.dto.ErrorCode;

public class ReferentialIntegrityException extends CreatorServiceException {
  public ReferentialIntegrityException(String message, Throwable cause) {
    super(ErrorCode.REFERENCED_ROW_MISSING, message, cause);
  }
}

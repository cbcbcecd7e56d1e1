package com.athena.creatorservice.common.exception;

import com.athena.creatorservice.common.dto.ErrorCode;

/**
 * A database CHECK constraint rejected a value that request validation let through.
 */
public class StorageConstraintException extends CreatorServiceException {
  public StorageConstraintException(String message, Throwable cause) {
    super(ErrorCode.CONSTRAINT_VIOLATED, message, cause);
  }
}

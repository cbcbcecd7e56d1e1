package com.athena.creatorservice.common;

import com.athena.creatorservice.common.dto.ApiResponse;
import com.athena.creatorservice.common.dto.ErrorCode;
import com.athena.creatorservice.common.exception.CreatorServiceException;
import com.athena.creatorservice.common.exception.ValidationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionController {

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidationException(ValidationException ex) {
    return ResponseEntity
        .status(ex.getErrorCode().getStatus())
        .body(ApiResponse.failure(ex.getMessage(), ex.getErrors()));
  }

  @ExceptionHandler(CreatorServiceException.class)
  public ResponseEntity<ApiResponse<Void>> handleServiceException(CreatorServiceException ex) {
    ErrorCode errorCode = ex.getErrorCode();
    if (errorCode.getStatus().is5xxServerError()) {
      log.error("Request failed with {}", errorCode.getValue(), ex);
    } else {
      log.warn("Request rejected with {}: {}", errorCode.getValue(), ex.getMessage());
    }
    return ResponseEntity.status(errorCode.getStatus()).body(ApiResponse.failure(ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
    List<String> errors = ex.getBindingResult().getFieldErrors().stream()
        .map(fieldError -> fieldError.getDefaultMessage())
        .toList();
    ErrorCode errorCode = ErrorCode.VALIDATION_FAILED;
    return ResponseEntity
        .status(errorCode.getStatus())
        .body(ApiResponse.failure(errorCode.getDescription(), errors));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    ErrorCode errorCode = ErrorCode.MALFORMED_REQUEST;
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity
        .status(errorCode.getStatus())
        .body(ApiResponse.failure(errorCode.getDescription()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
    if (ex instanceof ErrorResponse errorResponse) {
      HttpStatusCode status = errorResponse.getStatusCode();
      String detail = errorResponse.getBody().getDetail();
      return ResponseEntity.status(status)
          .body(ApiResponse.failure(detail != null ? detail : ex.getMessage()));
    }

    log.error("Unexpected error while handling request", ex);
    ErrorCode errorCode = ErrorCode.INTERNAL_ERROR;
    return ResponseEntity
        .status(errorCode.getStatus())
        .body(ApiResponse.failure(errorCode.getDescription()));
  }
}

package com.athena.creatorservice.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Envelope shared by every {@code /creator} endpoint. Absent members are omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "message", "data", "errors", "count"})
public record ApiResponse<T>(
    boolean success,
    String message,
    T data,
    List<String> errors,
    Integer count
) {
  public static <T> ApiResponse<T> ok(String message, T data) {
    return new ApiResponse<>(true, message, data, null, null);
  }

  public static <T> ApiResponse<List<T>> list(String message, List<T> data) {
    return new ApiResponse<>(true, message, data, null, data.size());
  }

  public static ApiResponse<Void> failure(String message) {
    return new ApiResponse<>(false, message, null, null, null);
  }

  public static ApiResponse<Void> failure(String message, List<String> errors) {
    List<String> reported = (errors == null || errors.isEmpty()) ? null : List.copyOf(errors);
    return new ApiResponse<>(false, message, null, reported, null);
  }
}

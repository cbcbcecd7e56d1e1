package com.athena.creatorservice.common.infrastructure;

import com.athena.creatorservice.common.exception.ReferentialIntegrityException;
import com.athena.creatorservice.common.exception.StorageConstraintException;
import java.sql.SQLException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates PostgreSQL integrity errors into caller-facing exceptions. Works on both raw jOOQ
 * exceptions and the Spring ones Boot's jOOQ listener converts them into, since either keeps the
 * driver's {@link SQLException} in its cause chain.
 */
public final class SqlStates {
  public static final String FOREIGN_KEY_VIOLATION = "23503";
  public static final String CHECK_VIOLATION = "23514";
  public static final String STRING_DATA_RIGHT_TRUNCATION = "22001";
  public static final String NUMERIC_VALUE_OUT_OF_RANGE = "22003";

  static final String DEFAULT_FOREIGN_KEY_MESSAGE = "Referenced row does not exist";
  private static final String DATA_EXCEPTION_CLASS = "22";

  private static final Pattern CONSTRAINT_NAME = Pattern.compile("constraint \"([^\"]+)\"");

  private SqlStates() {
  }

  public static Optional<SQLException> findSqlException(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof SQLException sqlException) {
        return Optional.of(sqlException);
      }
      current = current.getCause();
    }
    return Optional.empty();
  }

  public static Optional<String> sqlState(Throwable error) {
    return findSqlException(error).map(SQLException::getSQLState);
  }

  public static RuntimeException translate(RuntimeException error) {
    return translate(error, DEFAULT_FOREIGN_KEY_MESSAGE);
  }

  /**
   * Returns the exception to rethrow: a domain exception for foreign-key violations, check
   * violations and rejected values (SQLSTATE class 22), the original error otherwise.
   */
  public static RuntimeException translate(RuntimeException error, String foreignKeyMessage) {
    String state = sqlState(error).orElse("");
    return switch (state) {
      case FOREIGN_KEY_VIOLATION -> new ReferentialIntegrityException(foreignKeyMessage, error);
      case CHECK_VIOLATION -> new StorageConstraintException(describeCheckViolation(error), error);
      case STRING_DATA_RIGHT_TRUNCATION ->
          new StorageConstraintException("Invalid value - too long for its column", error);
      case NUMERIC_VALUE_OUT_OF_RANGE ->
          new StorageConstraintException("Invalid value - numeric field out of range", error);
      default -> state.startsWith(DATA_EXCEPTION_CLASS)
          ? new StorageConstraintException("Invalid value - rejected by the database", error)
          : error;
    };
  }

  static String describeCheckViolation(Throwable error) {
    String driverMessage = findSqlException(error).map(SQLException::getMessage).orElse("");
    Matcher matcher = CONSTRAINT_NAME.matcher(driverMessage == null ? "" : driverMessage);
    if (matcher.find()) {
      return "Invalid value - violates constraint " + matcher.group(1);
    }
    return "Invalid value - violates a check constraint";
  }
}

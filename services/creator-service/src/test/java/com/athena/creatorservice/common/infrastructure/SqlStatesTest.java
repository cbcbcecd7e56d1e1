package com.athena.creatorservice.common.infrastructure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.athena.creatorservice.common.exception.ReferentialIntegrityException;
import com.athena.creatorservice.common.exception.StorageConstraintException;
import java.sql.SQLException;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class SqlStatesTest {

  @Test
  void findsSqlStateDeepInCauseChain() {
    SQLException driver = new SQLException("fk", SqlStates.FOREIGN_KEY_VIOLATION);
    RuntimeException wrapped = new DataIntegrityViolationException("jooq",
        new org.jooq.exception.DataAccessException("SQL [insert]", driver));

    assertEquals(Optional.of("23503"), SqlStates.sqlState(wrapped));
  }

  @Test
  void foreignKeyViolationBecomesReferentialIntegrityException() {
    RuntimeException error = new DataIntegrityViolationException("insert failed",
        new SQLException("violates foreign key constraint", "23503"));

    RuntimeException translated = SqlStates.translate(error, "Invalid creator_id - user does not exist");

    assertInstanceOf(ReferentialIntegrityException.class, translated);
    assertEquals("Invalid creator_id - user does not exist", translated.getMessage());
    assertSame(error, translated.getCause());
  }

  @Test
  void checkViolationNamesTheConstraint() {
    RuntimeException error = new DataIntegrityViolationException("insert failed", new SQLException(
        "ERROR: new row for relation \"agents\" violates check constraint \"agents_visibility_check\"",
        "23514"));

    RuntimeException translated = SqlStates.translate(error, "unused");

    assertInstanceOf(StorageConstraintException.class, translated);
    assertEquals("Invalid value - violates constraint agents_visibility_check",
        translated.getMessage());
  }

  @Test
  void checkViolationWithoutConstraintNameGetsGenericMessage() {
    RuntimeException error = new DataIntegrityViolationException("insert failed",
        new SQLException("check failed", "23514"));

    assertEquals("Invalid value - violates a check constraint",
        SqlStates.translate(error, "unused").getMessage());
  }

  @Test
  void otherErrorsPassThrough() {
    RuntimeException error = new DataIntegrityViolationException("duplicate",
        new SQLException("duplicate key", "23505"));

    assertSame(error, SqlStates.translate(error, "unused"));
  }

  @Test
  void overlongStringBecomesStorageConstraintException() {
    RuntimeException error = new org.jooq.exception.DataAccessException("SQL [update]",
        new SQLException("value too long for type character varying(255)", "22001"));

    RuntimeException translated = SqlStates.translate(error, "unused");

    assertInstanceOf(StorageConstraintException.class, translated);
    assertEquals("Invalid value - too long for its column", translated.getMessage());
    assertSame(error, translated.getCause());
  }

  @Test
  void numericOverflowBecomesStorageConstraintException() {
    RuntimeException error = new DataIntegrityViolationException("insert failed",
        new SQLException("numeric field overflow", "22003"));

    RuntimeException translated = SqlStates.translate(error);

    assertInstanceOf(StorageConstraintException.class, translated);
    assertEquals("Invalid value - numeric field out of range", translated.getMessage());
  }

  @Test
  void otherDataExceptionsAreRejectedValues() {
    RuntimeException error = new DataIntegrityViolationException("insert failed",
        new SQLException("invalid input syntax for type json", "22P02"));

    assertEquals("Invalid value - rejected by the database",
        SqlStates.translate(error).getMessage());
  }

  @Test
  void foreignKeyViolationWithoutCallerMessageUsesDefault() {
    RuntimeException error = new DataIntegrityViolationException("insert failed",
        new SQLException("violates foreign key constraint", "23503"));

    assertEquals("Referenced row does not exist", SqlStates.translate(error).getMessage());
  }
}

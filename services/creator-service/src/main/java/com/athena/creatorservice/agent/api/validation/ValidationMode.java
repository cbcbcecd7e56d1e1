package com.athena.creatorservice.agent.api.validation;

public enum ValidationMode {
  /** Mandatory members must be present, absent optional members fall back to defaults. */
  CREATE,
  /** Nothing is mandatory, but every member present is checked, explicit nulls included. */
  UPDATE
}

package com.acme.triage.core;

/** A classification violated the structural contract of its schema version. */
public class SchemaValidationException extends PermanentException {

  private final String field;

  public SchemaValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}

package com.ibprovider.provider.schema;

/** Raised when a configured or computed value does not match its attribute declaration. */
public class SchemaValidationException extends RuntimeException {
  public SchemaValidationException(String message) {
    super(message);
  }
}

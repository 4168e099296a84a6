package io.intellixity.relata.persistence.cql.column;

/** A value does not fit the shape or types declared by its column. */
public class ColumnValidationException extends RuntimeException {
  public ColumnValidationException(String message) {
    super(message);
  }

  public ColumnValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}

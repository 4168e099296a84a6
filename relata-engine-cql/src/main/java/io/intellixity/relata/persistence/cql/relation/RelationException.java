package io.intellixity.relata.persistence.cql.relation;

/** Base type of every error raised by relation columns. */
public class RelationException extends RuntimeException {
  private final String model;

  public RelationException(String model, String message) {
    super(message);
    this.model = model;
  }

  public RelationException(String model, String message, Throwable cause) {
    super(message, cause);
    this.model = model;
  }

  /** Referenced model, or null when the column has none. */
  public String model() {
    return model;
  }
}

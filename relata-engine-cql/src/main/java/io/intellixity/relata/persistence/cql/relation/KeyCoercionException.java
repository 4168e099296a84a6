package io.intellixity.relata.persistence.cql.relation;

/** A key component cannot be encoded or decoded by its declared type. */
public final class KeyCoercionException extends RelationException {
  private final String field;

  public KeyCoercionException(String model, String field, String message) {
    super(model, message);
    this.field = field;
  }

  public KeyCoercionException(String model, String field, String message, Throwable cause) {
    super(model, message, cause);
    this.field = field;
  }

  /** Offending key field, or null when the whole value was rejected. */
  public String field() {
    return field;
  }
}

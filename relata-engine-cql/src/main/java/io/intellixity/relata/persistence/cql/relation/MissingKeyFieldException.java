package io.intellixity.relata.persistence.cql.relation;

/** A key value or a stored key map lacks one of the referenced model's primary key fields. */
public final class MissingKeyFieldException extends RelationException {
  private final String field;

  public MissingKeyFieldException(String model, String field) {
    super(model, "Missing primary key field '" + field + "' of model " + model);
    this.field = field;
  }

  public MissingKeyFieldException(String model, String field, Throwable cause) {
    super(model, "Missing primary key field '" + field + "' of model " + model, cause);
    this.field = field;
  }

  public String field() {
    return field;
  }
}

package io.intellixity.relata.persistence.cql.relation;

import java.util.Set;

/** A key value or a stored key map carries fields that are not primary key fields of the referenced model. */
public final class UnknownKeyFieldException extends RelationException {
  private final Set<String> fields;

  public UnknownKeyFieldException(String model, Set<String> fields) {
    super(model, "Fields " + fields + " are not primary key fields of model " + model);
    this.fields = Set.copyOf(fields);
  }

  public Set<String> fields() {
    return fields;
  }
}

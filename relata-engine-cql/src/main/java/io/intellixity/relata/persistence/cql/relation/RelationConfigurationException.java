package io.intellixity.relata.persistence.cql.relation;

/** Column definition can never work; raised when the column is built. */
public final class RelationConfigurationException extends RelationException {
  public RelationConfigurationException(String model, String message) {
    super(model, message);
  }
}

package io.intellixity.relata.persistence.cql.relation;

public final class SchemaResolutionException extends RelationException {
  public SchemaResolutionException(String model, String message) {
    super(model, message);
  }

  public SchemaResolutionException(String model, String message, Throwable cause) {
    super(model, message, cause);
  }
}

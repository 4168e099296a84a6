package io.intellixity.relata.persistence.cql.relation;

/** Resolves a model name to its primary key fields. */
@FunctionalInterface
public interface KeySchemaResolver {
  /** Throws {@link SchemaResolutionException} if the model is unknown or its key cannot be flattened. */
  KeySchema resolve(String model);
}

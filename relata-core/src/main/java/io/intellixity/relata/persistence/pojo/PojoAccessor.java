package io.intellixity.relata.persistence.pojo;

/** Read-side accessor for entity POJOs. */
public interface PojoAccessor<T> {
  Class<T> javaType();

  /**
   * Get a top-level field by its authoring name.\n
   *
   * Implementations are expected to be hand-written or generated (no reflection).\n
   */
  Object get(T pojo, String field);
}

package io.intellixity.relata.persistence.authoring;

public interface AuthoringRegistry {
  /** Throws {@link IllegalArgumentException} for an unknown authoring id. */
  EntityAuthoring getEntityAuthoring(String authoringId);
}

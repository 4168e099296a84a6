package io.intellixity.relata.persistence.pojo;

import java.util.Map;

public interface PojoAccessorRegistry {
  /** Returns the accessor for {@code authoringId}, or null if none is registered. */
  PojoAccessor<?> accessorFor(String authoringId);

  static PojoAccessorRegistry empty() {
    return authoringId -> null;
  }

  static PojoAccessorRegistry of(Map<String, PojoAccessor<?>> byAuthoringId) {
    Map<String, PojoAccessor<?>> copy = Map.copyOf(byAuthoringId);
    return copy::get;
  }
}

package io.intellixity.relata.persistence.authoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simple in-memory {@link AuthoringRegistry}.\n
 *
 * Useful for tests and for authoring loaded up-front by {@code JsonAuthoringLoader}.\n
 */
public final class InMemoryAuthoringRegistry implements AuthoringRegistry {
  private final Map<String, EntityAuthoring> entities = new LinkedHashMap<>();

  public InMemoryAuthoringRegistry(List<EntityAuthoring> eas) {
    for (EntityAuthoring ea : eas) {
      EntityAuthoring prev = entities.putIfAbsent(ea.type(), ea);
      if (prev != null) throw new IllegalArgumentException("Duplicate authoring type: " + ea.type());
    }
  }

  @Override
  public EntityAuthoring getEntityAuthoring(String authoringId) {
    EntityAuthoring ea = entities.get(authoringId);
    if (ea == null) throw new IllegalArgumentException("Unknown authoring type: " + authoringId);
    return ea;
  }
}

package io.intellixity.relata.persistence.authoring;

import java.util.Map;

/**
 * Declared field of an {@link EntityAuthoring}.\n
 *
 * A partition key is always part of the primary key, so {@code partitionKey=true} implies {@code key=true}.\n
 */
public record FieldDef(
    String userTypeId,
    boolean key,
    boolean partitionKey,
    Map<String, Object> attrs
) {
  public FieldDef {
    if (userTypeId == null || userTypeId.isBlank()) throw new IllegalArgumentException("userTypeId is required");
    key = key || partitionKey;
    attrs = attrs == null ? Map.of() : Map.copyOf(attrs);
  }

  public FieldDef(String userTypeId, boolean key, boolean partitionKey) {
    this(userTypeId, key, partitionKey, Map.of());
  }

  public static FieldDef column(String userTypeId) {
    return new FieldDef(userTypeId, false, false);
  }

  public static FieldDef partitionKey(String userTypeId) {
    return new FieldDef(userTypeId, true, true);
  }

  public static FieldDef clusteringKey(String userTypeId) {
    return new FieldDef(userTypeId, true, false);
  }
}

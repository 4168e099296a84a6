package io.intellixity.relata.persistence.cql.relation;

import java.util.Set;

/**
 * Primary key component types that survive a round trip through their text form.\n
 *
 * Key fields of any other type are refused when the key schema is resolved.\n
 */
public enum KeyLogicalType {
  TEXT("string", "text", "ascii"),
  IDENTIFIER("uuid", "timeuuid"),
  INTEGER("int"),
  BIGINT("long"),
  BOOLEAN("bool"),
  TIMESTAMP("instant", "timestamp");

  private final Set<String> userTypeIds;

  KeyLogicalType(String... userTypeIds) {
    this.userTypeIds = Set.of(userTypeIds);
  }

  /** Returns the logical type of {@code userTypeId}, or null if it is not allowed in keys. */
  public static KeyLogicalType of(String userTypeId) {
    if (userTypeId == null) return null;
    for (KeyLogicalType t : values()) {
      if (t.userTypeIds.contains(userTypeId)) return t;
    }
    return null;
  }
}

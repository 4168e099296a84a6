package io.intellixity.relata.persistence.cql.column;

import io.intellixity.relata.persistence.authoring.UserType;
import io.intellixity.relata.persistence.mapping.Coercions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CQL {@code map<K,V>} column.\n
 *
 * - {@link #validate(Object)}: shape check, every key and value must be accepted by its declared type\n
 * - {@link #toDatabase(Map)}: encode keys and values for the driver\n
 * - {@link #toJava(Object)}: decode a driver map; a missing map reads as empty\n
 */
public final class MapColumn<K, V> {
  private final UserType<K> keyType;
  private final UserType<V> valueType;

  public MapColumn(UserType<K> keyType, UserType<V> valueType) {
    this.keyType = Objects.requireNonNull(keyType, "keyType");
    this.valueType = Objects.requireNonNull(valueType, "valueType");
  }

  public String cqlType() {
    return "map<" + keyType.id() + "," + valueType.id() + ">";
  }

  public Map<K, V> validate(Object value) {
    if (value == null) return null;
    if (!(value instanceof Map<?, ?> m)) {
      throw new ColumnValidationException(cqlType() + " expects a map but got: " + value.getClass().getName());
    }
    Map<K, V> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      K k = check(keyType, e.getKey(), "key");
      if (k == null) throw new ColumnValidationException(cqlType() + " does not allow null keys");
      out.put(k, check(valueType, e.getValue(), "value"));
    }
    return Collections.unmodifiableMap(out);
  }

  public Map<Object, Object> toDatabase(Map<K, V> value) {
    if (value == null) return null;
    Map<Object, Object> out = new LinkedHashMap<>();
    for (var e : value.entrySet()) {
      out.put(keyType.encode(e.getKey()), e.getValue() == null ? null : valueType.encode(e.getValue()));
    }
    return out;
  }

  public Map<K, V> toJava(Object raw) {
    if (raw == null) return Map.of();
    try {
      return Collections.unmodifiableMap(Coercions.toMap(raw, keyType::decode, valueType::decode));
    } catch (IllegalArgumentException e) {
      throw new ColumnValidationException("Cannot read " + cqlType() + " value", e);
    }
  }

  private <T> T check(UserType<T> type, Object v, String role) {
    if (v == null) return null;
    if (!type.accepts(v)) {
      throw new ColumnValidationException(cqlType() + " " + role + " must be " + type.javaType().getSimpleName()
          + " but got: " + v.getClass().getName());
    }
    T typed = type.javaType().cast(v);
    try {
      type.encode(typed);
    } catch (IllegalArgumentException e) {
      throw new ColumnValidationException("Invalid " + cqlType() + " " + role + ": " + e.getMessage(), e);
    }
    return typed;
  }
}

package io.intellixity.relata.persistence.authoring;

/**
 * Logical column type.\n
 *
 * {@link #encode(Object)} produces the driver-native value written to the store;\n
 * {@link #decode(Object)} accepts whatever the driver hands back on read (and, for every\n
 * scalar type, the textual form of its own encoded value).\n
 */
public interface UserType<T> {
  String id();
  Class<T> javaType();
  T decode(Object raw);
  Object encode(T value);

  /** True if {@code value} can be passed to {@link #encode(Object)} as-is. */
  default boolean accepts(Object value) {
    return value != null && javaType().isInstance(value);
  }
}

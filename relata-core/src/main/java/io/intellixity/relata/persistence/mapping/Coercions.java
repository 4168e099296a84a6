package io.intellixity.relata.persistence.mapping;

import java.util.*;
import java.util.function.*;

public final class Coercions {
  private Coercions() {}

  /** Decodes every entry of a raw map; keeps the source iteration order. */
  public static <K,V> Map<K,V> toMap(Object raw, Function<Object,K> dk, Function<Object,V> dv) {
    if (raw == null) return null;
    if (raw instanceof Map<?,?> m) {
      Map<K,V> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(dk.apply(e.getKey()), dv.apply(e.getValue()));
      return out;
    }
    throw new IllegalArgumentException("Expected map but got: " + raw.getClass());
  }

  /** True for null, empty maps, empty collections and empty strings. */
  public static boolean isEmpty(Object value) {
    if (value == null) return true;
    if (value instanceof Map<?,?> m) return m.isEmpty();
    if (value instanceof Collection<?> c) return c.isEmpty();
    if (value instanceof CharSequence s) return s.length() == 0;
    return false;
  }
}

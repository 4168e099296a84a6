package io.intellixity.relata.persistence.mapping;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CoercionsTest {

  @Test
  void toMap_decodesEntriesInOrder() {
    Map<Object, Object> raw = new LinkedHashMap<>();
    raw.put("b", 2);
    raw.put("a", 1);
    Map<String, Long> out = Coercions.toMap(raw, String::valueOf, v -> ((Number) v).longValue());
    assertEquals(List.of("b", "a"), List.copyOf(out.keySet()));
    assertEquals(2L, out.get("b"));
  }

  @Test
  void toMap_rejectsNonMaps() {
    assertNull(Coercions.toMap(null, String::valueOf, String::valueOf));
    assertThrows(IllegalArgumentException.class, () -> Coercions.toMap(List.of(), String::valueOf, String::valueOf));
  }

  @Test
  void isEmpty_coversNullAndEmptyContainers() {
    assertTrue(Coercions.isEmpty(null));
    assertTrue(Coercions.isEmpty(Map.of()));
    assertTrue(Coercions.isEmpty(List.of()));
    assertTrue(Coercions.isEmpty(""));
    assertFalse(Coercions.isEmpty(Map.of("a", "b")));
    assertFalse(Coercions.isEmpty(0));
  }
}

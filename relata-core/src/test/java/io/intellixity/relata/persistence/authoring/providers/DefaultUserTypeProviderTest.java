package io.intellixity.relata.persistence.authoring.providers;

import io.intellixity.relata.persistence.authoring.UserType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultUserTypeProviderTest {

  private static UserType<?> byId(String id) {
    return new DefaultUserTypeProvider().userTypes().stream()
        .filter(ut -> id.equals(ut.id()))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Missing userType: " + id));
  }

  @Test
  void scalars_decodeTheirOwnTextForm() {
    UUID u = UUID.randomUUID();
    assertEquals(u, byId("uuid").decode(u.toString()));
    assertEquals(7, byId("int").decode("7"));
    assertEquals(7L, byId("long").decode(" 7 "));
    assertEquals(true, byId("bool").decode("TRUE"));
    assertEquals(1.5d, byId("double").decode("1.5"));
    assertEquals("x", byId("string").decode("x"));
  }

  @Test
  void bool_rejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> byId("bool").decode("yes"));
  }

  @Test
  void instant_acceptsDateAndIsoText() {
    Instant ts = Instant.parse("2025-01-01T00:00:00Z");
    assertEquals(ts, byId("instant").decode(Date.from(ts)));
    assertEquals(ts, byId("instant").decode("2025-01-01T00:00:00Z"));
  }

  @Test
  void accepts_checksJavaType() {
    assertTrue(byId("uuid").accepts(UUID.randomUUID()));
    assertFalse(byId("uuid").accepts("not-a-uuid-object"));
    assertFalse(byId("uuid").accepts(null));
  }
}

package io.intellixity.relata.persistence.authoring;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EntityAuthoringTest {

  @Test
  void partitionKey_impliesKey() {
    FieldDef fd = new FieldDef("string", false, true);
    assertTrue(fd.key());
  }

  @Test
  void javaType_mustBeFqcn() {
    assertThrows(IllegalArgumentException.class, () -> new EntityAuthoring("Order", "orders", "Order", Map.of()));
  }

  @Test
  void source_isRequired() {
    assertThrows(IllegalArgumentException.class, () -> new EntityAuthoring("Order", " ", "com.acme.Order", Map.of()));
  }

  @Test
  void keyFields_excludeRegularColumns() {
    Map<String, FieldDef> fields = new LinkedHashMap<>();
    fields.put("day", FieldDef.clusteringKey("instant"));
    fields.put("note", FieldDef.column("string"));
    fields.put("tenant", FieldDef.partitionKey("string"));
    EntityAuthoring ea = new EntityAuthoring("Event", "events", "com.acme.Event", fields);

    assertEquals(List.of("tenant", "day"), List.copyOf(ea.keyFields().keySet()));
    assertEquals(List.of("day", "note", "tenant"), List.copyOf(ea.fields().keySet()));
  }

  @Test
  void inMemoryRegistry_rejectsUnknownAndDuplicateTypes() {
    EntityAuthoring ea = new EntityAuthoring("Event", "events", "com.acme.Event",
        Map.of("id", FieldDef.partitionKey("uuid")));
    InMemoryAuthoringRegistry reg = new InMemoryAuthoringRegistry(List.of(ea));

    assertSame(ea, reg.getEntityAuthoring("Event"));
    assertThrows(IllegalArgumentException.class, () -> reg.getEntityAuthoring("Nope"));
    assertThrows(IllegalArgumentException.class, () -> new InMemoryAuthoringRegistry(List.of(ea, ea)));
  }
}

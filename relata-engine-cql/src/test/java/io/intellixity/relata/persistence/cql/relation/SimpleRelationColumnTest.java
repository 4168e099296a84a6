package io.intellixity.relata.persistence.cql.relation;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class SimpleRelationColumnTest {

  @Test
  void relation_acceptsUuidOrUuidText() {
    SimpleRelationColumn c = RelationColumns.relation(Map.of("model", "Account", "index", true));
    UUID id = UUID.randomUUID();

    assertEquals(id, c.validate(id));
    assertEquals(id, c.validate(id.toString()));
    assertEquals(id, c.toDatabase(id.toString()));
    assertEquals(id, c.toJava(id));
    assertNull(c.validate(null));
    assertNull(c.validate(" "));
    assertEquals("uuid", c.cqlType());
  }

  @Test
  void relation_rejectsNonUuids() {
    SimpleRelationColumn c = RelationColumns.relation(Map.of("model", "Account"));
    KeyCoercionException ex = assertThrows(KeyCoercionException.class, () -> c.validate("nope"));
    assertEquals("Account", ex.model());
    assertThrows(KeyCoercionException.class, () -> c.validate(42));
  }

  @Test
  void sqlRelation_readsBackAsString() {
    StringRelationColumn c = RelationColumns.sqlRelation(Map.of("model", "Invoice"));
    UUID id = UUID.randomUUID();

    assertEquals(id, c.toDatabase(id));
    assertEquals(id.toString(), c.toJava(id));
    assertEquals(id.toString(), c.toJava(id.toString().toUpperCase()));
    assertNull(c.toJava(null));
    assertEquals("Invoice", c.config().model());
  }

  @Test
  void model_isRequired() {
    RelationConfigurationException ex = assertThrows(RelationConfigurationException.class, () -> RelationColumns.relation(Map.of()));
    assertEquals("No model provided.", ex.getMessage());
    assertThrows(RelationConfigurationException.class, () -> RelationColumns.sqlRelation(Map.of("model", "")));
  }
}

package io.intellixity.relata.persistence.authoring.json;

import io.intellixity.relata.persistence.authoring.EntityAuthoring;
import io.intellixity.relata.persistence.authoring.FieldDef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JsonAuthoringLoaderTest {

  @Test
  void loadsResource_keepingFieldOrder() {
    List<EntityAuthoring> eas = JsonAuthoringLoader.fromResource("authoring/foreign-model.json");
    assertEquals(2, eas.size());

    EntityAuthoring fm = eas.get(0);
    assertEquals("ForeignModel", fm.type());
    assertEquals("foreign_model", fm.source());
    assertEquals("com.acme.ForeignModel", fm.javaType());
    assertEquals(List.of("info", "start_date", "organization", "key"), List.copyOf(fm.fields().keySet()));
    assertEquals(FieldDef.column("string"), fm.fields().get("info"));
    assertEquals("random", fm.fields().get("key").attrs().get("default"));
  }

  @Test
  void keyFields_putPartitionKeysFirst() {
    EntityAuthoring fm = JsonAuthoringLoader.fromResource("authoring/foreign-model.json").get(0);
    Map<String, FieldDef> keys = fm.keyFields();
    assertEquals(List.of("organization", "start_date", "key"), List.copyOf(keys.keySet()));
    assertTrue(keys.get("organization").partitionKey());
    assertFalse(keys.get("key").partitionKey());
  }

  @Test
  void singleObjectDocument_isAccepted() {
    String s = """
        {
          "type": "Tag",
          "source": "tags",
          "javaType": "com.acme.Tag",
          "fields": { "name": { "type": "string", "partitionKey": true } }
        }
        """;
    List<EntityAuthoring> eas = JsonAuthoringLoader.fromString(s);
    assertEquals(1, eas.size());
    assertEquals(FieldDef.partitionKey("string"), eas.get(0).fields().get("name"));
  }

  @Test
  void fieldWithoutType_isRejected() {
    String s = """
        { "type": "Tag", "source": "tags", "javaType": "com.acme.Tag", "fields": { "name": { "key": true } } }
        """;
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> JsonAuthoringLoader.fromString(s));
    assertTrue(ex.getMessage().contains("Tag.name"));
  }

  @Test
  void missingResource_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> JsonAuthoringLoader.fromResource("authoring/nope.json"));
  }

  @Test
  void malformedJson_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> JsonAuthoringLoader.fromString("{ \"type\": "));
  }
}

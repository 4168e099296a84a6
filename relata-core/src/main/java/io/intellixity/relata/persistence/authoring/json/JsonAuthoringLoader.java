package io.intellixity.relata.persistence.authoring.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.persistence.authoring.EntityAuthoring;
import io.intellixity.relata.persistence.authoring.FieldDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Loads {@link EntityAuthoring} from JSON documents.\n
 *
 * A document is either a single entity object or an array of them:\n
 *\n
 * <pre>\n
 * {\n
 *   "type": "ForeignModel",\n
 *   "source": "foreign_model",\n
 *   "javaType": "com.acme.ForeignModel",\n
 *   "fields": {\n
 *     "organization": { "type": "string", "partitionKey": true },\n
 *     "start_date":   { "type": "instant", "key": true },\n
 *     "info":         { "type": "string" }\n
 *   }\n
 * }\n
 * </pre>\n
 *
 * Field order in the document is kept, since it decides clustering key order.\n
 */
public final class JsonAuthoringLoader {
  private static final Logger log = LoggerFactory.getLogger(JsonAuthoringLoader.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private JsonAuthoringLoader() {}

  public static List<EntityAuthoring> fromString(String json) {
    try {
      return fromTree(JSON.readTree(json));
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed authoring JSON", e);
    }
  }

  /** Loads a classpath resource; fails if the resource is missing. */
  public static List<EntityAuthoring> fromResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JsonAuthoringLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Authoring resource not found: " + resource);
      List<EntityAuthoring> out = fromTree(JSON.readTree(in));
      log.debug("Loaded {} authoring(s) from {}", out.size(), resource);
      return out;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read authoring resource: " + resource, e);
    }
  }

  static List<EntityAuthoring> fromTree(JsonNode root) {
    if (root == null || root.isNull() || root.isMissingNode()) return List.of();
    List<EntityAuthoring> out = new ArrayList<>();
    if (root.isArray()) {
      for (JsonNode n : root) out.add(parseEntity(n));
    } else if (root.isObject()) {
      out.add(parseEntity(root));
    } else {
      throw new IllegalArgumentException("Authoring JSON must be an object or an array");
    }
    return out;
  }

  private static EntityAuthoring parseEntity(JsonNode n) {
    if (!n.isObject()) throw new IllegalArgumentException("Authoring entry must be an object");
    String type = textOrNull(n.get("type"));
    Map<String, FieldDef> fields = new LinkedHashMap<>();
    JsonNode fs = n.get("fields");
    if (fs != null && !fs.isNull()) {
      if (!fs.isObject()) throw new IllegalArgumentException("fields must be an object for authoring: " + type);
      Iterator<Map.Entry<String, JsonNode>> it = fs.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        fields.put(e.getKey(), parseField(type, e.getKey(), e.getValue()));
      }
    }
    return new EntityAuthoring(type, textOrNull(n.get("source")), textOrNull(n.get("javaType")), fields);
  }

  private static FieldDef parseField(String entity, String name, JsonNode f) {
    // shorthand: "organization": "string"
    if (f.isTextual()) return FieldDef.column(f.asText());
    if (!f.isObject()) throw new IllegalArgumentException("Field " + entity + "." + name + " must be an object or a type name");
    String type = textOrNull(f.get("type"));
    if (type == null) throw new IllegalArgumentException("Field " + entity + "." + name + " has no type");
    Map<String, Object> attrs = Map.of();
    JsonNode a = f.get("attrs");
    if (a != null && a.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = JSON.convertValue(a, Map.class);
      attrs = m;
    }
    return new FieldDef(type.trim(), boolOrFalse(f.get("key")), boolOrFalse(f.get("partitionKey")), attrs);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrFalse(JsonNode n) {
    return n != null && n.asBoolean(false);
  }
}

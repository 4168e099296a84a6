package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.mapping.Coercions;
import io.intellixity.relata.persistence.pojo.PojoAccessor;
import io.intellixity.relata.persistence.pojo.PojoAccessorRegistry;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Flattens the composite primary key of a referenced model into a {@code map<ascii,text>} and back.\n
 *
 * Both directions walk the resolved key schema, not the input, so missing and foreign fields\n
 * are always reported. The key schema is resolved on first use and kept for the life of the codec.\n
 */
public final class CompositeKeyCodec {
  private final String model;
  private final KeySchemaResolver resolver;
  private final PojoAccessorRegistry accessors;
  private final KeyValueNormalizer normalizer = new KeyValueNormalizer();
  private final AtomicReference<KeySchema> schema = new AtomicReference<>();

  public CompositeKeyCodec(String model, KeySchemaResolver resolver, PojoAccessorRegistry accessors) {
    this.model = Objects.requireNonNull(model, "model");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.accessors = accessors == null ? PojoAccessorRegistry.empty() : accessors;
  }

  public String model() {
    return model;
  }

  /**
   * Key schema of the referenced model.\n
   *
   * Concurrent first callers may each resolve it; all of them get the first stored result.\n
   */
  public KeySchema schema() {
    KeySchema s = schema.get();
    if (s != null) return s;
    KeySchema resolved = resolver.resolve(model);
    if (resolved == null) throw new SchemaResolutionException(model, "No key schema for model: " + model);
    schema.compareAndSet(null, resolved);
    return schema.get();
  }

  /**
   * Encodes an entity instance or a key map into its flat text form.\n
   *
   * Null and empty input mean "no relation" and encode to an empty map. A map that is already\n
   * flat encodes to an equal map.\n
   */
  public Map<String, String> encode(Object value) {
    if (Coercions.isEmpty(value)) return Map.of();
    KeySchema s = schema();

    Map<?, ?> components = (value instanceof Map<?, ?> m) ? m : extract(s, value);
    rejectUnknown(s, components.keySet());

    Map<String, String> out = new LinkedHashMap<>();
    for (KeyField f : s.fields()) {
      if (!components.containsKey(f.id())) throw new MissingKeyFieldException(model, f.id());
      out.put(f.id(), normalizer.encode(model, f, components.get(f.id())));
    }
    return Collections.unmodifiableMap(out);
  }

  /** Decodes a stored flat map back into typed key components, in key order. */
  public Map<String, Object> decode(Map<String, String> mapping) {
    if (mapping == null || mapping.isEmpty()) return Map.of();
    KeySchema s = schema();
    rejectUnknown(s, mapping.keySet());

    Map<String, Object> out = new LinkedHashMap<>();
    for (KeyField f : s.fields()) {
      if (!mapping.containsKey(f.id())) throw new MissingKeyFieldException(model, f.id());
      out.put(f.id(), normalizer.decode(model, f, mapping.get(f.id())));
    }
    return Collections.unmodifiableMap(out);
  }

  /** True if {@code value} is an instance of the referenced model. */
  public boolean isEntity(Object value) {
    PojoAccessor<?> accessor = accessors.accessorFor(model);
    return value != null && accessor != null && accessor.javaType().isInstance(value);
  }

  private Map<String, Object> extract(KeySchema s, Object entity) {
    if (!isEntity(entity)) {
      throw new KeyCoercionException(model, null,
          "Cannot use a " + entity.getClass().getName() + " as a key of model " + model);
    }
    @SuppressWarnings("unchecked")
    PojoAccessor<Object> accessor = (PojoAccessor<Object>) accessors.accessorFor(model);
    Map<String, Object> out = new LinkedHashMap<>();
    for (KeyField f : s.fields()) {
      try {
        out.put(f.id(), accessor.get(entity, f.id()));
      } catch (IllegalArgumentException e) {
        throw new MissingKeyFieldException(model, f.id(), e);
      }
    }
    return out;
  }

  private void rejectUnknown(KeySchema s, Set<?> keys) {
    Set<String> ids = s.fieldIds();
    Set<String> unknown = new LinkedHashSet<>();
    for (Object k : keys) {
      if (!(k instanceof String id) || !ids.contains(id)) unknown.add(String.valueOf(k));
    }
    if (!unknown.isEmpty()) throw new UnknownKeyFieldException(model, unknown);
  }
}

package io.intellixity.relata.persistence.authoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EntityAuthoring(
    String type,
    /** Table name. */
    String source,
    /** Fully-qualified Java type name (FQCN), e.g. com.acme.domain.Address */
    String javaType,
    /** Field declaration order is preserved. */
    Map<String, FieldDef> fields
) {
  public EntityAuthoring {
    if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required for authoring");
    if (source == null || source.isBlank()) throw new IllegalArgumentException("source is required for authoring: " + type);
    if (javaType == null || javaType.isBlank()) throw new IllegalArgumentException("javaType is required for authoring: " + type);
    if (!javaType.contains(".")) throw new IllegalArgumentException("javaType must be FQCN (e.g. com.acme.Foo) for authoring: " + type);
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Primary key fields: partition keys first, then clustering keys, each in declaration order.\n
   */
  public Map<String, FieldDef> keyFields() {
    Map<String, FieldDef> out = new LinkedHashMap<>();
    for (var e : fields.entrySet()) if (e.getValue().partitionKey()) out.put(e.getKey(), e.getValue());
    for (var e : fields.entrySet()) if (e.getValue().key() && !e.getValue().partitionKey()) out.put(e.getKey(), e.getValue());
    return Collections.unmodifiableMap(out);
  }
}

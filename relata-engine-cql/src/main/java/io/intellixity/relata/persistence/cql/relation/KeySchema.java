package io.intellixity.relata.persistence.cql.relation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Ordered primary key fields of a referenced model. */
public record KeySchema(String model, List<KeyField> fields) {
  public KeySchema {
    if (model == null || model.isBlank()) throw new IllegalArgumentException("model is required");
    fields = List.copyOf(fields);
    if (fields.isEmpty()) throw new IllegalArgumentException("model " + model + " declares no primary key");
  }

  /** Field ids in key order. */
  public Set<String> fieldIds() {
    Map<String, KeyField> byId = new LinkedHashMap<>();
    for (KeyField f : fields) byId.put(f.id(), f);
    return Collections.unmodifiableSet(byId.keySet());
  }
}

package io.intellixity.relata.persistence.cql.relation;

import java.util.Map;

/** Configuration shared by every relation column: the name of the referenced model. */
public record RelationConfig(String model) {
  public static final String MODEL = "model";
  public static final String INDEX = "index";

  public RelationConfig {
    if (model == null || model.isBlank()) throw new RelationConfigurationException(null, "No model provided.");
    model = model.trim();
  }

  /** Parses column options; {@code model} is required. */
  public static RelationConfig from(Map<String, ?> options) {
    Object m = options == null ? null : options.get(MODEL);
    return new RelationConfig(m == null ? null : String.valueOf(m));
  }

  /** True if the options ask for a secondary index ({@code index: true} or {@code "true"}). */
  public static boolean indexRequested(Map<String, ?> options) {
    if (options == null) return false;
    Object v = options.get(INDEX);
    if (v instanceof Boolean b) return b;
    return v != null && Boolean.parseBoolean(String.valueOf(v).trim());
  }
}

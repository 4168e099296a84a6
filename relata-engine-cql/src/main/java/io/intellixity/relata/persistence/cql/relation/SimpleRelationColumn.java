package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.authoring.DiscoveredUserTypeRegistry;
import io.intellixity.relata.persistence.authoring.UserType;

import java.util.Objects;
import java.util.UUID;

/** Points at a row whose primary key is a single UUID. */
public final class SimpleRelationColumn implements ReferenceColumn<UUID, UUID> {
  private static final UserType<UUID> UUID_TYPE = DiscoveredUserTypeRegistry.GlobalTypes.uuid();

  private final RelationConfig config;

  public SimpleRelationColumn(RelationConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public RelationConfig config() {
    return config;
  }

  @Override
  public String cqlType() {
    return "uuid";
  }

  @Override
  public UUID validate(Object value) {
    if (value == null) return null;
    if (value instanceof String s && s.isBlank()) return null;
    if (!(value instanceof UUID) && !(value instanceof String)) {
      throw new KeyCoercionException(config.model(), null,
          "Relation to " + config.model() + " expects a UUID but got: " + value.getClass().getName());
    }
    try {
      return UUID_TYPE.decode(value);
    } catch (IllegalArgumentException e) {
      throw new KeyCoercionException(config.model(), null,
          "Relation to " + config.model() + " expects a UUID but got: '" + value + "'", e);
    }
  }

  @Override
  public Object toDatabase(Object value) {
    return UUID_TYPE.encode(validate(value));
  }

  @Override
  public UUID toJava(Object raw) {
    return validate(raw);
  }
}

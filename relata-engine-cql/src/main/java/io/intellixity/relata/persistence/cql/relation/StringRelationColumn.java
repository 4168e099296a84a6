package io.intellixity.relata.persistence.cql.relation;

import java.util.UUID;

/**
 * Points at a row kept in an external SQL store under a UUID primary key.\n
 *
 * Stored as a CQL uuid but read back as its canonical string, which SQL query builders bind as-is.\n
 */
public final class StringRelationColumn implements ReferenceColumn<String, UUID> {
  private final SimpleRelationColumn uuid;

  public StringRelationColumn(RelationConfig config) {
    this.uuid = new SimpleRelationColumn(config);
  }

  @Override
  public RelationConfig config() {
    return uuid.config();
  }

  @Override
  public String cqlType() {
    return uuid.cqlType();
  }

  @Override
  public UUID validate(Object value) {
    return uuid.validate(value);
  }

  @Override
  public Object toDatabase(Object value) {
    return uuid.toDatabase(value);
  }

  @Override
  public String toJava(Object raw) {
    UUID u = uuid.toJava(raw);
    return u == null ? null : u.toString();
  }
}

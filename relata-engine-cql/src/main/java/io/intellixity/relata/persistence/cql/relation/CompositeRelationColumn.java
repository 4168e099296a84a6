package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.cql.CqlUserTypeProvider;
import io.intellixity.relata.persistence.cql.column.MapColumn;
import io.intellixity.relata.persistence.mapping.Coercions;
import io.intellixity.relata.persistence.pojo.PojoAccessorRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Points at a row whose primary key has several components.\n
 *
 * The key is stored as a {@code map<ascii,text>}: ascii because each map key names a key field and\n
 * has to be a CQL identifier, text because components of any type are stored in text form.\n
 * Neither type can be overridden.\n
 *
 * Secondary indexes are refused: CQL matches indexed map entries loosely, which cannot identify a row.\n
 */
public final class CompositeRelationColumn implements ReferenceColumn<Map<String, Object>, Map<String, String>> {
  private final RelationConfig config;
  private final CompositeKeyCodec codec;
  private final MapColumn<String, String> storage =
      new MapColumn<>(CqlUserTypeProvider.ascii(), CqlUserTypeProvider.text());

  public CompositeRelationColumn(RelationConfig config, boolean index,
                                 KeySchemaResolver resolver, PojoAccessorRegistry accessors) {
    this.config = Objects.requireNonNull(config, "config");
    if (index) {
      throw new RelationConfigurationException(config.model(),
          "Secondary indexes on composite relations are not allowed.");
    }
    this.codec = new CompositeKeyCodec(config.model(), resolver, accessors);
  }

  public CompositeRelationColumn(RelationConfig config, KeySchemaResolver resolver, PojoAccessorRegistry accessors) {
    this(config, false, resolver, accessors);
  }

  @Override
  public RelationConfig config() {
    return config;
  }

  @Override
  public String cqlType() {
    return storage.cqlType();
  }

  /**
   * Normalizes an entity instance, a key map or an already flat map into the flat form.\n
   *
   * The map column's own shape validation runs last.\n
   */
  @Override
  public Map<String, String> validate(Object value) {
    Map<String, String> flat = Coercions.isEmpty(value) ? Map.of() : codec.encode(value);
    return storage.validate(flat);
  }

  @Override
  public Map<Object, Object> toDatabase(Object value) {
    return storage.toDatabase(validate(value));
  }

  /** Reads the stored map, then rebuilds typed key components. An unset relation reads as an empty map. */
  @Override
  public Map<String, Object> toJava(Object raw) {
    return codec.decode(storage.toJava(raw));
  }
}

package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.pojo.PojoAccessorRegistry;

import java.util.Map;

/** Builds relation columns from column options ({@code model}, {@code index}). */
public final class RelationColumns {
  private RelationColumns() {}

  public static SimpleRelationColumn relation(Map<String, ?> options) {
    return new SimpleRelationColumn(RelationConfig.from(options));
  }

  public static StringRelationColumn sqlRelation(Map<String, ?> options) {
    return new StringRelationColumn(RelationConfig.from(options));
  }

  public static CompositeRelationColumn compositeRelation(Map<String, ?> options,
                                                          KeySchemaResolver resolver,
                                                          PojoAccessorRegistry accessors) {
    return new CompositeRelationColumn(RelationConfig.from(options), RelationConfig.indexRequested(options), resolver, accessors);
  }
}

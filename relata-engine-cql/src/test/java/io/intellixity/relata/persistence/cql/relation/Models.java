package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.authoring.DiscoveredUserTypeRegistry;
import io.intellixity.relata.persistence.authoring.InMemoryAuthoringRegistry;
import io.intellixity.relata.persistence.authoring.json.JsonAuthoringLoader;
import io.intellixity.relata.persistence.cql.CqlUserTypeProvider;
import io.intellixity.relata.persistence.pojo.PojoAccessorRegistry;

import java.time.Instant;
import java.util.Map;

/** Shared test fixtures: authoring from {@code authoring/models.json} over discovered CQL user types. */
final class Models {
  static final InMemoryAuthoringRegistry AUTHORING =
      new InMemoryAuthoringRegistry(JsonAuthoringLoader.fromResource("authoring/models.json"));
  static final DiscoveredUserTypeRegistry USER_TYPES = new DiscoveredUserTypeRegistry(CqlUserTypeProvider.DIALECT);
  static final PojoAccessorRegistry ACCESSORS = PojoAccessorRegistry.of(Map.of("ForeignModel", ForeignModel.ACCESSOR));

  private Models() {}

  static KeySchemaResolver resolver() {
    return new AuthoringKeySchemaResolver(AUTHORING, USER_TYPES);
  }

  static CompositeKeyCodec codec(String model) {
    return new CompositeKeyCodec(model, resolver(), ACCESSORS);
  }

  /** Same truncation the CQL driver applies when writing a timestamp. */
  static Instant truncateToMillis(Instant ts) {
    return Instant.ofEpochMilli(ts.toEpochMilli());
  }
}

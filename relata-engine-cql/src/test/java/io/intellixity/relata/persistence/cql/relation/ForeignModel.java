package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.pojo.PojoAccessor;

import java.time.Instant;
import java.util.UUID;

/** Referenced entity with a three-part primary key (organization, start_date, key). */
record ForeignModel(String organization, Instant startDate, UUID key, String info) {

  static final PojoAccessor<ForeignModel> ACCESSOR = new PojoAccessor<>() {
    @Override public Class<ForeignModel> javaType() { return ForeignModel.class; }

    @Override
    public Object get(ForeignModel pojo, String field) {
      return switch (field) {
        case "organization" -> pojo.organization();
        case "start_date" -> pojo.startDate();
        case "key" -> pojo.key();
        case "info" -> pojo.info();
        default -> throw new IllegalArgumentException("Unknown field: " + field);
      };
    }
  };
}

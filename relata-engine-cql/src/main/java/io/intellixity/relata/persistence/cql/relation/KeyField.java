package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.authoring.UserType;

import java.util.Objects;

/** One primary key component of a referenced model. */
public record KeyField(String id, KeyLogicalType logicalType, UserType<?> userType) {
  public KeyField {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(logicalType, "logicalType");
    Objects.requireNonNull(userType, "userType");
  }
}

package io.intellixity.relata.persistence.authoring;

public interface UserTypeRegistry {
  /** Returns the type registered under {@code userTypeId}; throws {@link IllegalArgumentException} if unknown. */
  UserType<?> get(String userTypeId);
}

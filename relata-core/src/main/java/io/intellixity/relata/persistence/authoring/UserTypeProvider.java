package io.intellixity.relata.persistence.authoring;

import java.util.Collection;

/**
 * Discovers {@link UserType} implementations.\n
 *
 * Resolution semantics:\n
 * - Provider is keyed by {@link #dialectId()}.\n
 * - {@code "*"} means global (fallback).\n
 * - For a given store, dialect-specific types override global ones by id.\n
 */
public interface UserTypeProvider {
  /** Dialect id this provider targets, or "*" for global. */
  String dialectId();

  Collection<UserType<?>> userTypes();
}

package io.intellixity.relata.persistence.authoring.providers;

import io.intellixity.relata.persistence.authoring.DiscoveredUserTypeRegistry;
import io.intellixity.relata.persistence.authoring.UserType;
import io.intellixity.relata.persistence.authoring.UserTypeProvider;

import java.util.Collection;
import java.util.List;

/** Global built-in scalar user types (dialectId="*"). */
public final class DefaultUserTypeProvider implements UserTypeProvider {
  @Override
  public String dialectId() {
    return DiscoveredUserTypeRegistry.GLOBAL_DIALECT;
  }

  @Override
  public Collection<UserType<?>> userTypes() {
    return List.of(
        DiscoveredUserTypeRegistry.GlobalTypes.string(),
        DiscoveredUserTypeRegistry.GlobalTypes.integer(),
        DiscoveredUserTypeRegistry.GlobalTypes.longType(),
        DiscoveredUserTypeRegistry.GlobalTypes.bool(),
        DiscoveredUserTypeRegistry.GlobalTypes.doubleType(),
        DiscoveredUserTypeRegistry.GlobalTypes.uuid(),
        DiscoveredUserTypeRegistry.GlobalTypes.instant()
    );
  }
}

package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.authoring.AuthoringRegistry;
import io.intellixity.relata.persistence.authoring.EntityAuthoring;
import io.intellixity.relata.persistence.authoring.FieldDef;
import io.intellixity.relata.persistence.authoring.UserType;
import io.intellixity.relata.persistence.authoring.UserTypeRegistry;
import io.intellixity.relata.persistence.cql.CqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link KeySchemaResolver} backed by authoring.\n
 *
 * Each key field must:\n
 * - have an id usable as a CQL identifier (it becomes a map key)\n
 * - have a type listed in {@link KeyLogicalType}\n
 * - have its type registered in the {@link UserTypeRegistry}\n
 * - for timestamps, have a type that encodes to epoch milliseconds and decodes epoch seconds\n
 */
public final class AuthoringKeySchemaResolver implements KeySchemaResolver {
  private static final Logger log = LoggerFactory.getLogger(AuthoringKeySchemaResolver.class);

  private final AuthoringRegistry authoring;
  private final UserTypeRegistry userTypes;

  public AuthoringKeySchemaResolver(AuthoringRegistry authoring, UserTypeRegistry userTypes) {
    this.authoring = Objects.requireNonNull(authoring, "authoring");
    this.userTypes = Objects.requireNonNull(userTypes, "userTypes");
  }

  @Override
  public KeySchema resolve(String model) {
    EntityAuthoring ea;
    try {
      ea = authoring.getEntityAuthoring(model);
    } catch (IllegalArgumentException e) {
      throw new SchemaResolutionException(model, "Unknown model: " + model, e);
    }
    if (ea == null) throw new SchemaResolutionException(model, "Unknown model: " + model);

    Map<String, FieldDef> keys = ea.keyFields();
    if (keys.isEmpty()) throw new SchemaResolutionException(model, "Model " + model + " declares no primary key");

    List<KeyField> fields = new ArrayList<>(keys.size());
    for (var e : keys.entrySet()) {
      String id = e.getKey();
      String typeId = e.getValue().userTypeId();
      if (!CqlIdentifiers.isValid(id)) {
        throw new SchemaResolutionException(model, "Key field '" + id + "' of model " + model + " is not a CQL identifier");
      }
      KeyLogicalType logical = KeyLogicalType.of(typeId);
      if (logical == null) {
        throw new SchemaResolutionException(model,
            "Key field '" + id + "' of model " + model + " has type '" + typeId + "' which cannot be stored as text");
      }
      UserType<?> ut;
      try {
        ut = userTypes.get(typeId);
      } catch (IllegalArgumentException ex) {
        throw new SchemaResolutionException(model, "No user type '" + typeId + "' for key field '" + id + "'", ex);
      }
      if (logical == KeyLogicalType.TIMESTAMP && !storesEpochMillis(ut)) {
        throw new SchemaResolutionException(model,
            "Timestamp key field '" + id + "' of model " + model + " uses type '" + typeId
                + "' which does not read and write epoch time");
      }
      fields.add(new KeyField(id, logical, ut));
    }

    KeySchema schema = new KeySchema(model, fields);
    log.debug("Resolved key schema of {}: {}", model, schema.fieldIds());
    return schema;
  }

  @SuppressWarnings("unchecked")
  private static boolean storesEpochMillis(UserType<?> ut) {
    try {
      Object wire = ((UserType<Object>) ut).encode(ut.decode(1.5d));
      return wire instanceof Number n && n.longValue() == 1500L;
    } catch (RuntimeException e) {
      log.debug("User type '{}' cannot round-trip epoch time: {}", ut.id(), e.toString());
      return false;
    }
  }
}

package io.intellixity.relata.persistence.cql;

import io.intellixity.relata.persistence.authoring.DiscoveredUserTypeRegistry;
import io.intellixity.relata.persistence.authoring.UserType;
import io.intellixity.relata.persistence.authoring.UserTypeProvider;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * CQL-specific UserTypes (dialectId="cql").
 *
 * Key override: timestamps are asymmetric on the CQL driver. Writes take epoch milliseconds as a
 * long; native reads hand back epoch seconds as a floating-point number with millisecond precision.
 */
public final class CqlUserTypeProvider implements UserTypeProvider {
  public static final String DIALECT = "cql";

  @Override
  public String dialectId() {
    return DIALECT;
  }

  @Override
  public Collection<UserType<?>> userTypes() {
    return List.of(
        new CqlTimestampType("instant"),
        new CqlTimestampType("timestamp"),
        new CqlAsciiType(),
        new CqlTextType(),
        new CqlTimeUuidType()
    );
  }

  /** {@code ascii} type restricted to CQL identifiers. */
  public static UserType<String> ascii() {
    return new CqlAsciiType();
  }

  public static UserType<String> text() {
    return new CqlTextType();
  }

  /** Timestamp: encode to epoch millis (sub-millisecond precision is dropped), decode from epoch seconds. */
  static final class CqlTimestampType implements UserType<Instant> {
    private final String id;

    CqlTimestampType(String id) {
      this.id = id;
    }

    @Override public String id() { return id; }
    @Override public Class<Instant> javaType() { return Instant.class; }

    @Override
    public Instant decode(Object raw) {
      if (raw == null) return null;
      if (raw instanceof Instant i) return i;
      if (raw instanceof Date d) return d.toInstant();
      if (raw instanceof Number n) return Instant.ofEpochMilli(Math.round(n.doubleValue() * 1000d));
      return Instant.parse(String.valueOf(raw).trim());
    }

    @Override
    public Object encode(Instant value) {
      if (value == null) return null;
      return value.toEpochMilli();
    }
  }

  /** ASCII restricted to the CQL identifier grammar. */
  static final class CqlAsciiType implements UserType<String> {
    @Override public String id() { return "ascii"; }
    @Override public Class<String> javaType() { return String.class; }

    @Override
    public String decode(Object raw) {
      if (raw == null) return null;
      return CqlIdentifiers.require(String.valueOf(raw));
    }

    @Override
    public Object encode(String value) {
      if (value == null) return null;
      return CqlIdentifiers.require(value);
    }
  }

  static final class CqlTextType implements UserType<String> {
    @Override public String id() { return "text"; }
    @Override public Class<String> javaType() { return String.class; }

    @Override
    public String decode(Object raw) {
      return raw == null ? null : String.valueOf(raw);
    }

    @Override
    public Object encode(String value) {
      return value;
    }
  }

  static final class CqlTimeUuidType implements UserType<UUID> {
    private final UserType<UUID> uuid = DiscoveredUserTypeRegistry.GlobalTypes.uuid();

    @Override public String id() { return "timeuuid"; }
    @Override public Class<UUID> javaType() { return UUID.class; }

    @Override
    public UUID decode(Object raw) {
      UUID u = uuid.decode(raw);
      if (u != null && u.version() != 1) throw new IllegalArgumentException("Not a time-based UUID: " + u);
      return u;
    }

    @Override
    public Object encode(UUID value) {
      if (value != null && value.version() != 1) throw new IllegalArgumentException("Not a time-based UUID: " + value);
      return value;
    }
  }
}

package io.intellixity.relata.persistence.authoring;

import io.intellixity.relata.persistence.util.RelataFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * UserTypeRegistry built via discovery (META-INF/relata.factories).\n
 *
 * Lookup order:\n
 * - dialect-specific provider types (by UserType.id)\n
 * - global provider types (dialectId="*")\n
 * - error\n
 */
public final class DiscoveredUserTypeRegistry implements UserTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredUserTypeRegistry.class);

  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final Map<String, UserType<?>> dialectTypes;
  private final Map<String, UserType<?>> globalTypes;

  public DiscoveredUserTypeRegistry(String dialectId) {
    this(dialectId, RelataFactoriesLoader.load(UserTypeProvider.class));
  }

  public DiscoveredUserTypeRegistry(String dialectId, List<UserTypeProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? "" : dialectId;
    Map<String, UserType<?>> dialect = new LinkedHashMap<>();
    Map<String, UserType<?>> global = new LinkedHashMap<>();

    for (UserTypeProvider p : providers) {
      if (p == null) continue;
      String did = normalizeDialect(p.dialectId());
      Collection<UserType<?>> types = p.userTypes();
      if (types == null) continue;
      for (UserType<?> ut : types) {
        if (ut == null) continue;
        if (GLOBAL_DIALECT.equals(did)) {
          global.putIfAbsent(ut.id(), ut);
        } else if (Objects.equals(this.dialectId, did)) {
          // keep first discovered for determinism
          dialect.putIfAbsent(ut.id(), ut);
        }
      }
    }

    for (String id : dialect.keySet()) {
      if (global.containsKey(id)) log.debug("Dialect '{}' overrides global user type '{}'", this.dialectId, id);
    }

    this.dialectTypes = Map.copyOf(dialect);
    this.globalTypes = Map.copyOf(global);
  }

  @Override
  public UserType<?> get(String userTypeId) {
    if (userTypeId == null || userTypeId.isBlank()) {
      throw new IllegalArgumentException("Unknown userTypeId: " + userTypeId);
    }
    UserType<?> t = dialectTypes.get(userTypeId);
    if (t != null) return t;
    t = globalTypes.get(userTypeId);
    if (t != null) return t;
    throw new IllegalArgumentException("Unknown userTypeId: " + userTypeId + " (dialectId=" + dialectId + ")");
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }

  // ---- global scalar types for providers ----

  public static final class GlobalTypes {
    private GlobalTypes() {}

    public static UserType<String> string() {
      return new UserType<>() {
        @Override public String id() { return "string"; }
        @Override public Class<String> javaType() { return String.class; }
        @Override public String decode(Object raw) { return raw == null ? null : String.valueOf(raw); }
        @Override public Object encode(String value) { return value; }
      };
    }

    public static UserType<Integer> integer() {
      return new UserType<>() {
        @Override public String id() { return "int"; }
        @Override public Class<Integer> javaType() { return Integer.class; }
        @Override public Integer decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof Number n) return n.intValue();
          return Integer.parseInt(String.valueOf(raw).trim());
        }
        @Override public Object encode(Integer value) { return value; }
      };
    }

    public static UserType<Long> longType() {
      return new UserType<>() {
        @Override public String id() { return "long"; }
        @Override public Class<Long> javaType() { return Long.class; }
        @Override public Long decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof Number n) return n.longValue();
          return Long.parseLong(String.valueOf(raw).trim());
        }
        @Override public Object encode(Long value) { return value; }
      };
    }

    public static UserType<Boolean> bool() {
      return new UserType<>() {
        @Override public String id() { return "bool"; }
        @Override public Class<Boolean> javaType() { return Boolean.class; }
        @Override public Boolean decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof Boolean b) return b;
          String s = String.valueOf(raw).trim();
          if (s.equalsIgnoreCase("true")) return true;
          if (s.equalsIgnoreCase("false")) return false;
          throw new IllegalArgumentException("Not a boolean: " + s);
        }
        @Override public Object encode(Boolean value) { return value; }
      };
    }

    public static UserType<Double> doubleType() {
      return new UserType<>() {
        @Override public String id() { return "double"; }
        @Override public Class<Double> javaType() { return Double.class; }
        @Override public Double decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof Number n) return n.doubleValue();
          return Double.parseDouble(String.valueOf(raw));
        }
        @Override public Object encode(Double value) { return value; }
      };
    }

    public static UserType<UUID> uuid() {
      return new UserType<>() {
        @Override public String id() { return "uuid"; }
        @Override public Class<UUID> javaType() { return UUID.class; }
        @Override public UUID decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof UUID u) return u;
          return UUID.fromString(String.valueOf(raw).trim());
        }
        @Override public Object encode(UUID value) { return value; }
      };
    }

    public static UserType<Instant> instant() {
      return new UserType<>() {
        @Override public String id() { return "instant"; }
        @Override public Class<Instant> javaType() { return Instant.class; }
        @Override public Instant decode(Object raw) {
          if (raw == null) return null;
          if (raw instanceof Instant i) return i;
          if (raw instanceof java.util.Date d) return d.toInstant();
          return Instant.parse(String.valueOf(raw));
        }
        @Override public Object encode(Instant value) { return value; }
      };
    }
  }
}

package io.intellixity.relata.persistence.cql.relation;

import io.intellixity.relata.persistence.authoring.UserType;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Converts primary key components to and from their canonical text form.\n
 *
 * Encode:\n
 * - text is kept as-is once it is known to decode (empty text becomes null)\n
 * - timestamps become the decimal epoch milliseconds the CQL driver writes natively;\n
 *   a naive {@link LocalDateTime} is taken as UTC\n
 * - anything else goes through the field's native encode, then {@link String#valueOf(Object)}\n
 *
 * Decode:\n
 * - timestamp text is turned back into epoch seconds (millis / 1000.0), the shape the driver\n
 *   returns on a native read, before the field's native decode sees it\n
 * - anything else is handed to the field's native decode unchanged\n
 */
public final class KeyValueNormalizer {

  public String encode(String model, KeyField field, Object value) {
    if (value == null) return null;
    if (value instanceof String s) {
      if (s.isEmpty()) return null;
      decode(model, field, s);
      return s;
    }

    Object wire = encodeNative(model, field, toFieldJavaType(model, field, value));
    if (wire == null) return null;
    if (field.logicalType() == KeyLogicalType.TIMESTAMP) return Long.toString(epochMillis(model, field, wire));
    String s = String.valueOf(wire);
    return s.isEmpty() ? null : s;
  }

  public Object decode(String model, KeyField field, Object raw) {
    if (raw == null) return null;
    Object nativeRead = raw;
    if (field.logicalType() == KeyLogicalType.TIMESTAMP && raw instanceof String s) {
      try {
        nativeRead = Long.parseLong(s) / 1000.0d;
      } catch (NumberFormatException e) {
        throw new KeyCoercionException(model, field.id(),
            "Key field '" + field.id() + "' expects epoch milliseconds but got '" + s + "'", e);
      }
    }
    try {
      return field.userType().decode(nativeRead);
    } catch (RuntimeException e) {
      throw new KeyCoercionException(model, field.id(),
          "Cannot decode key field '" + field.id() + "' as " + field.userType().id() + ": '" + raw + "'", e);
    }
  }

  private static Object toFieldJavaType(String model, KeyField field, Object value) {
    Object v = value;
    switch (field.logicalType()) {
      case TIMESTAMP -> {
        if (v instanceof Date d) v = d.toInstant();
        else if (v instanceof OffsetDateTime odt) v = odt.toInstant();
        else if (v instanceof ZonedDateTime zdt) v = zdt.toInstant();
        else if (v instanceof LocalDateTime ldt) v = ldt.toInstant(ZoneOffset.UTC);
      }
      case BIGINT -> {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) v = ((Number) v).longValue();
      }
      case INTEGER -> {
        if (v instanceof Short || v instanceof Byte) v = ((Number) v).intValue();
      }
      default -> { }
    }
    if (!field.userType().accepts(v)) {
      throw new KeyCoercionException(model, field.id(),
          "Key field '" + field.id() + "' of type " + field.userType().id() + " cannot take a " + value.getClass().getName());
    }
    return v;
  }

  @SuppressWarnings("unchecked")
  private static Object encodeNative(String model, KeyField field, Object value) {
    UserType<Object> ut = (UserType<Object>) field.userType();
    try {
      return ut.encode(value);
    } catch (RuntimeException e) {
      throw new KeyCoercionException(model, field.id(),
          "Cannot encode key field '" + field.id() + "' as " + ut.id() + ": " + value, e);
    }
  }

  private static long epochMillis(String model, KeyField field, Object wire) {
    if (wire instanceof Number n) return n.longValue();
    throw new KeyCoercionException(model, field.id(),
        "Timestamp key field '" + field.id() + "' of type " + field.userType().id()
            + " must encode to epoch milliseconds but encoded to " + wire.getClass().getName());
  }
}

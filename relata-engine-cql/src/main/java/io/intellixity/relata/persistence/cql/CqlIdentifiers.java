package io.intellixity.relata.persistence.cql;

import java.util.regex.Pattern;

/**
 * CQL identifier grammar ({@code [A-Za-z0-9_]*}).\n
 *
 * Map keys standing in for column names must satisfy it, otherwise CQL cannot reference them.\n
 */
public final class CqlIdentifiers {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]*");

  private CqlIdentifiers() {}

  public static boolean isValid(String s) {
    return s != null && IDENTIFIER.matcher(s).matches();
  }

  public static String require(String s) {
    if (!isValid(s)) throw new IllegalArgumentException("Not a CQL identifier: '" + s + "'");
    return s;
  }
}

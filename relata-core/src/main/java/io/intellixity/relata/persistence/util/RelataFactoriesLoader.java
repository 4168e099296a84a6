package io.intellixity.relata.persistence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for relata SPIs.\n
 *
 * Reads every {@code META-INF/relata.factories} resource on the classpath. Each resource is a\n
 * Java Properties file mapping an SPI interface name to comma-separated implementation names:\n
 *\n
 * <pre>\n
 * io.intellixity.relata.persistence.authoring.UserTypeProvider=com.acme.MyProvider,com.acme.OtherProvider\n
 * </pre>\n
 *
 * Implementations need a public no-arg constructor. Duplicates are loaded once, in discovery order.\n
 */
public final class RelataFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(RelataFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/relata.factories";

  private RelataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = RelataFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    LinkedHashSet<String> implNames = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    log.debug("Loaded {} implementation(s) of {}: {}", out.size(), key, implNames);
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed for SPI " + spiType.getName() + " was not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}

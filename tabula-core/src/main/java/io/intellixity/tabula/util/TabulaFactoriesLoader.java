package io.intellixity.tabula.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Finds the storage engines available to a store.
 *
 * Every engine jar registers its connector in {@code META-INF/tabula.factories}, keyed by the interface name:
 *
 * <pre>
 * io.intellixity.tabula.exec.EngineConnector=io.intellixity.tabula.jdbc.sqlite.SqliteConnector
 * </pre>
 *
 * A jar that appears twice on the classpath yields one instance. {@link io.intellixity.tabula.exec.EngineConnectors}
 * is the usual entry point.
 */
public final class TabulaFactoriesLoader {
  public static final String RESOURCE = "META-INF/tabula.factories";

  private TabulaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = TabulaFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    // LinkedHashSet: de-dupe while keeping classpath order
    Set<String> implNames = new LinkedHashSet<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      implNames.addAll(splitNames(p.getProperty(key)));
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  static List<String> splitNames(String value) {
    if (value == null || value.isBlank()) return List.of();
    List<String> names = new ArrayList<>();
    for (String part : value.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) names.add(name);
    }
    return names;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      @SuppressWarnings("unchecked")
      Class<? extends T> impl = (Class<? extends T>) raw;
      return impl.getDeclaredConstructor().newInstance();
    } catch (IllegalArgumentException e) {
      throw e;
    } catch (ReflectiveOperationException | LinkageError e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}

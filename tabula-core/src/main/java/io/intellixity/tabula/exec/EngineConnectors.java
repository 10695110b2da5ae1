package io.intellixity.tabula.exec;

import io.intellixity.tabula.util.TabulaFactoriesLoader;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/** Lookup of {@link EngineConnector}s registered in {@code META-INF/tabula.factories}. */
public final class EngineConnectors {
  private EngineConnectors() {}

  public static List<EngineConnector> discovered() {
    return TabulaFactoriesLoader.load(EngineConnector.class);
  }

  public static EngineConnector byId(String id) {
    Objects.requireNonNull(id, "id");
    String wanted = id.trim().toLowerCase(Locale.ROOT);
    List<EngineConnector> all = discovered();
    for (EngineConnector c : all) {
      if (c.id().equalsIgnoreCase(wanted)) return c;
    }
    String known = all.stream().map(EngineConnector::id).collect(Collectors.joining(", "));
    throw new IllegalArgumentException("No engine connector '" + id + "' on the classpath (found: [" + known + "])");
  }
}

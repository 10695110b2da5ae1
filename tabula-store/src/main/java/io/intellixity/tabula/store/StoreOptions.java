package io.intellixity.tabula.store;

import io.intellixity.tabula.exec.EngineConnector;
import io.intellixity.tabula.exec.EngineConnectors;
import io.intellixity.tabula.gate.ConfirmationGate;
import io.intellixity.tabula.gate.ConfirmationGates;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Immutable settings for a {@link Store}.
 *
 * Keys understood by {@link #fromProperties(Properties)}:
 * <pre>
 * tabula.verbosity=0                  # chatter threshold, see {@link Chatter}
 * tabula.confirm=prompt               # prompt | allow | deny
 * tabula.engine=sqlite                # id of an EngineConnector from META-INF/tabula.factories
 * tabula.sqlite.busyTimeoutMs=5000    # passed through to the connector
 * </pre>
 */
public final class StoreOptions {
  public static final String RESOURCE = "tabula.properties";
  public static final String VERBOSITY_KEY = "tabula.verbosity";
  public static final String CONFIRM_KEY = "tabula.confirm";
  public static final String ENGINE_KEY = "tabula.engine";
  public static final String DEFAULT_ENGINE = "sqlite";

  private final int verbosity;
  private final ConfirmationGate gate;
  private final EngineConnector connector;
  private final LongSupplier epochSeconds;
  private final Consumer<String> chatterSink;

  private StoreOptions(Builder b) {
    if (b.verbosity < 0) throw new IllegalArgumentException("verbosity must be >= 0");
    this.verbosity = b.verbosity;
    this.gate = Objects.requireNonNull(b.gate, "gate");
    this.connector = (b.connector != null)
        ? b.connector
        : EngineConnectors.byId(b.engineId).configure(b.settings);
    this.epochSeconds = Objects.requireNonNull(b.epochSeconds, "epochSeconds");
    this.chatterSink = Objects.requireNonNull(b.chatterSink, "chatterSink");
  }

  /** Defaults: verbosity 0, console prompt, SQLite, wall clock, chatter to SLF4J. */
  public static StoreOptions defaults() {
    return builder().build();
  }

  /** Read {@value #RESOURCE} from the context class loader; falls back to {@link #defaults()} when absent. */
  public static StoreOptions load() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = StoreOptions.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + RESOURCE, e);
    }
    return fromProperties(p);
  }

  public static StoreOptions fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    Builder b = builder();
    String v = props.getProperty(VERBOSITY_KEY);
    if (v != null && !v.isBlank()) {
      try {
        b.verbosity(Integer.parseInt(v.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + VERBOSITY_KEY + ": '" + v + "'", e);
      }
    }
    String confirm = props.getProperty(CONFIRM_KEY);
    if (confirm != null) b.gate(ConfirmationGates.forPolicy(confirm));
    String engine = props.getProperty(ENGINE_KEY);
    if (engine != null && !engine.isBlank()) b.engine(engine.trim());
    b.settings(props);
    return b.build();
  }

  public static Builder builder() { return new Builder(); }

  public Builder toBuilder() {
    return new Builder()
        .verbosity(verbosity)
        .gate(gate)
        .connector(connector)
        .clock(epochSeconds)
        .chatterSink(chatterSink);
  }

  public int verbosity() { return verbosity; }
  public ConfirmationGate gate() { return gate; }
  public EngineConnector connector() { return connector; }
  public LongSupplier clock() { return epochSeconds; }
  public Consumer<String> chatterSink() { return chatterSink; }

  public static final class Builder {
    private int verbosity;
    private ConfirmationGate gate;
    private EngineConnector connector;
    private String engineId = DEFAULT_ENGINE;
    private Properties settings = new Properties();
    private LongSupplier epochSeconds = () -> System.currentTimeMillis() / 1000L;
    private Consumer<String> chatterSink = Chatter.loggingSink();

    private Builder() {}

    public Builder verbosity(int verbosity) { this.verbosity = verbosity; return this; }

    public Builder gate(ConfirmationGate gate) { this.gate = gate; return this; }

    /** Use this connector instead of discovering one by engine id. */
    public Builder connector(EngineConnector connector) { this.connector = connector; return this; }

    public Builder engine(String engineId) { this.engineId = Objects.requireNonNull(engineId, "engineId"); return this; }

    /** Engine-specific settings handed to {@link EngineConnector#configure(Properties)}. */
    public Builder settings(Properties settings) { this.settings = Objects.requireNonNull(settings, "settings"); return this; }

    /** Clock returning seconds since epoch, used to stamp history entries. */
    public Builder clock(LongSupplier epochSeconds) { this.epochSeconds = epochSeconds; return this; }

    public Builder chatterSink(Consumer<String> chatterSink) { this.chatterSink = chatterSink; return this; }

    public StoreOptions build() {
      if (gate == null) gate = ConfirmationGates.forPolicy("prompt");
      return new StoreOptions(this);
    }
  }
}

package io.intellixity.tabula.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Echoes progress lines to the caller.
 *
 * A line of level {@code L} reaches the sink when {@code L >= verbosity}, so verbosity 0 echoes everything and
 * raising it silences the lower levels. Every line is logged at DEBUG regardless. Persisted history is never
 * affected.
 */
public final class Chatter {
  private static final Logger log = LoggerFactory.getLogger(Chatter.class);

  /** Level used for lifecycle lines (opened, cancelled, deleting). */
  public static final int LIFECYCLE = 1;

  private final Consumer<String> sink;
  private int verbosity;

  public Chatter(int verbosity, Consumer<String> sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
    setVerbosity(verbosity);
  }

  /** Sink that forwards to SLF4J at INFO. */
  public static Consumer<String> loggingSink() {
    return line -> log.info("{}", line);
  }

  public int verbosity() { return verbosity; }

  public void setVerbosity(int verbosity) {
    if (verbosity < 0) throw new IllegalArgumentException("verbosity must be >= 0");
    this.verbosity = verbosity;
  }

  public void say(String line, int level) {
    log.debug("tabula.chatter level={} line={}", level, line);
    if (level >= verbosity) sink.accept(line);
  }
}

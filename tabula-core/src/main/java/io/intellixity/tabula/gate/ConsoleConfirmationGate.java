package io.intellixity.tabula.gate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Objects;

/**
 * Asks a human operator on a terminal-like stream pair.
 *
 * Loops until {@code y} or {@code n} is entered (case-insensitive). After the first bad answer only the short
 * prompt is repeated. End of input counts as "no".
 */
public final class ConsoleConfirmationGate implements ConfirmationGate {
  static final String RULE = "****************************************************************";

  private final BufferedReader in;
  private final PrintWriter out;

  public ConsoleConfirmationGate() {
    this(new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())),
        new PrintWriter(new OutputStreamWriter(System.out, Charset.defaultCharset()), true));
  }

  public ConsoleConfirmationGate(BufferedReader in, PrintWriter out) {
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public boolean confirm(String entity, EntityKind kind) {
    Objects.requireNonNull(kind, "kind");
    boolean minimal = false;
    while (true) {
      if (minimal) {
        out.print(" Overwrite? (y,n) : ");
      } else {
        out.print(" ****WARNING**** " + capitalize(kind.label()) + ": '" + entity + "' exists.\n"
            + " If you continue it *WILL* be overwritten\n"
            + " Overwrite? (y,n) : ");
      }
      out.flush();

      String line;
      try {
        line = in.readLine();
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read confirmation for " + kind.label() + " '" + entity + "'", e);
      }
      if (line == null) {
        out.println();
        return false;
      }

      String option = line.trim().toUpperCase(Locale.ROOT);
      if (option.equals("Y") || option.equals("N")) {
        out.println(RULE);
        return option.equals("Y");
      }
      out.println("ERROR: unrecognised choice '" + option + "'");
      minimal = true;
    }
  }

  private static String capitalize(String s) {
    if (s == null || s.isEmpty()) return s;
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}

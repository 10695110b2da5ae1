package io.intellixity.tabula.gate;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

/** Non-interactive {@link ConfirmationGate} implementations for pipelines and tests. */
public final class ConfirmationGates {
  private ConfirmationGates() {}

  private static final ConfirmationGate ALLOW = (entity, kind) -> true;
  private static final ConfirmationGate DENY = (entity, kind) -> false;

  public static ConfirmationGate allow() { return ALLOW; }

  public static ConfirmationGate deny() { return DENY; }

  /**
   * Answers with the given decisions in order, one per question.
   * Asking more questions than scripted is a test bug and fails fast.
   */
  public static ConfirmationGate scripted(Boolean... answers) {
    Objects.requireNonNull(answers, "answers");
    Deque<Boolean> queue = new ArrayDeque<>(Arrays.asList(answers));
    return (entity, kind) -> {
      Boolean next = queue.pollFirst();
      if (next == null) {
        throw new IllegalStateException("No scripted answer left for " + kind.label() + " '" + entity + "'");
      }
      return next;
    };
  }

  /** Parse a policy name as used by {@code tabula.confirm}: {@code prompt}, {@code allow} or {@code deny}. */
  public static ConfirmationGate forPolicy(String policy) {
    String p = policy == null ? "prompt" : policy.trim().toLowerCase(java.util.Locale.ROOT);
    return switch (p) {
      case "", "prompt" -> new ConsoleConfirmationGate();
      case "allow", "yes" -> allow();
      case "deny", "no" -> deny();
      default -> throw new IllegalArgumentException("Unknown confirmation policy '" + policy + "'");
    };
  }
}

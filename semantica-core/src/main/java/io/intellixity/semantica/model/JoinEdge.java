package io.intellixity.semantica.model;

import java.util.Map;

/**
 * Declared relationship between two tables.
 * <p>
 * {@code one}/{@code many} name the sides of a one-to-many relationship. Traversal ignores the
 * roles; {@code on} is emitted verbatim whichever side is reached first.
 */
public record JoinEdge(String one, String many, String on) {
  public JoinEdge {
    one = ModelChecks.requireText(one, "join", "one", one + "->" + many);
    many = ModelChecks.requireText(many, "join", "many", one + "->" + many);
    on = ModelChecks.requireText(on, "join", "join", one + "->" + many);
  }

  /** Accepts {@code join} (canonical) or {@code on} for the condition fragment. */
  public static JoinEdge fromMap(Map<String, Object> m) {
    String on = ModelChecks.text(m, "join");
    if (on == null) on = ModelChecks.text(m, "on");
    return new JoinEdge(ModelChecks.text(m, "one"), ModelChecks.text(m, "many"), on);
  }
}

package io.intellixity.semantica.sql.resolve;

import io.intellixity.semantica.model.JoinEdge;
import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.SemanticQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Connects the required tables to the base table using the model's declared join edges.
 * <p>
 * Worklist search: starting from {@code {base}}, repeated passes walk the edges in declaration
 * order and take the first edge that links a reached table to a still-needed one, in either
 * direction. A table reached earlier in a pass can be extended from by later edges of the same
 * pass. Passes stop when nothing is left, or fail with UNRESOLVABLE_JOIN when a pass adds nothing.
 * <p>
 * This is first-fit, not shortest-path: on graphs with several routes the declaration order of
 * the edges decides which JOINs are emitted.
 */
public final class JoinPathResolver {
  private static final Logger log = LoggerFactory.getLogger(JoinPathResolver.class);

  private final List<JoinEdge> edges;

  public JoinPathResolver(SemanticModel model) {
    this(Objects.requireNonNull(model, "model").joins());
  }

  public JoinPathResolver(List<JoinEdge> edges) {
    this.edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
  }

  /** Returns {@code JOIN <table> ON <condition>} fragments, in emission order. */
  public List<String> resolvePath(String baseTable, Set<String> requiredTables) {
    Objects.requireNonNull(baseTable, "baseTable");
    if (requiredTables == null || requiredTables.size() <= 1) return List.of();

    Set<String> processed = new HashSet<>();
    processed.add(baseTable);
    Set<String> remaining = new LinkedHashSet<>(requiredTables);
    remaining.removeAll(processed);

    List<String> joins = new ArrayList<>();
    // Each productive pass removes at least one table; the bound only guards malformed input.
    int maxPasses = Math.max(1, edges.size() * remaining.size());
    int pass = 0;

    while (!remaining.isEmpty()) {
      if (pass++ >= maxPasses) throw SemanticQueryException.unresolvableJoin(new ArrayList<>(remaining));

      boolean progressed = false;
      for (JoinEdge e : edges) {
        String reached = null;
        if (processed.contains(e.one()) && remaining.contains(e.many())) {
          reached = e.many();
        } else if (processed.contains(e.many()) && remaining.contains(e.one())) {
          reached = e.one();
        }
        if (reached == null) continue;

        joins.add("JOIN " + reached + " ON " + e.on());
        processed.add(reached);
        remaining.remove(reached);
        progressed = true;
        if (log.isTraceEnabled()) {
          log.trace("semantica.join pass={} base={} reached={} via={}->{}", pass, baseTable, reached, e.one(), e.many());
        }
      }

      if (!progressed) throw SemanticQueryException.unresolvableJoin(new ArrayList<>(remaining));
    }

    return joins;
  }
}

package io.intellixity.semantica.sql;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A compiled request: the final SQL text plus the fragments it was assembled from.
 * {@code orderBy} and {@code limit} are null when the request had none.
 */
public record CompiledQuery(
    String sql,
    String baseTable,
    Set<String> requiredTables,
    List<String> select,
    List<String> joins,
    List<String> where,
    List<String> groupBy,
    List<String> having,
    String orderBy,
    String limit
) {
  public CompiledQuery {
    requiredTables = requiredTables == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(requiredTables));
    select = select == null ? List.of() : List.copyOf(select);
    joins = joins == null ? List.of() : List.copyOf(joins);
    where = where == null ? List.of() : List.copyOf(where);
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    having = having == null ? List.of() : List.copyOf(having);
  }

  @Override
  public String toString() { return sql; }
}

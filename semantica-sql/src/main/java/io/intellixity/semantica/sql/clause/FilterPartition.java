package io.intellixity.semantica.sql.clause;

import java.util.List;

/** Filter conditions split by where they apply: before aggregation (WHERE) or after (HAVING). */
public record FilterPartition(List<String> where, List<String> having) {
  public FilterPartition {
    where = where == null ? List.of() : List.copyOf(where);
    having = having == null ? List.of() : List.copyOf(having);
  }
}

package io.intellixity.semantica.model;

import java.util.Map;

/** A named SQL expression, usually an aggregate, evaluated against its owning table. */
public record MetricDefinition(String name, String table, String sql) {
  public MetricDefinition {
    name = ModelChecks.requireText(name, "metric", "name", name);
    table = ModelChecks.requireText(table, "metric", "table", name);
    sql = ModelChecks.requireText(sql, "metric", "sql", name);
  }

  public static MetricDefinition fromMap(Map<String, Object> m) {
    return new MetricDefinition(ModelChecks.text(m, "name"), ModelChecks.text(m, "table"), ModelChecks.text(m, "sql"));
  }
}

package io.intellixity.semantica.model;

import java.util.Map;

/** A named column (unqualified) of its owning table, usable for grouping and filtering. */
public record DimensionDefinition(String name, String table, String sql) {
  public DimensionDefinition {
    name = ModelChecks.requireText(name, "dimension", "name", name);
    table = ModelChecks.requireText(table, "dimension", "table", name);
    sql = ModelChecks.requireText(sql, "dimension", "sql", name);
  }

  /** {@code <table>.<sql>}, the column as it appears in WHERE and ungrained SELECT/GROUP BY items. */
  public String qualifiedColumn() { return table + "." + sql; }

  public static DimensionDefinition fromMap(Map<String, Object> m) {
    return new DimensionDefinition(ModelChecks.text(m, "name"), ModelChecks.text(m, "table"), ModelChecks.text(m, "sql"));
  }
}

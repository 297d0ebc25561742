package io.intellixity.semantica.sql.resolve;

import io.intellixity.semantica.model.DimensionDefinition;
import io.intellixity.semantica.model.MetricDefinition;

/** Outcome of {@link FieldResolver#resolve}: what a bare name refers to. */
public record ResolvedField(FieldKind kind, String name, String table, String sql) {
  private static final ResolvedField NONE = new ResolvedField(FieldKind.NONE, null, null, null);

  public static ResolvedField of(DimensionDefinition d) {
    return new ResolvedField(FieldKind.DIMENSION, d.name(), d.table(), d.sql());
  }

  public static ResolvedField of(MetricDefinition m) {
    return new ResolvedField(FieldKind.METRIC, m.name(), m.table(), m.sql());
  }

  public static ResolvedField none() { return NONE; }

  public boolean isResolved() { return kind != FieldKind.NONE; }
}

package io.intellixity.semantica.sql.resolve;

import io.intellixity.semantica.model.DimensionDefinition;
import io.intellixity.semantica.model.MetricDefinition;
import io.intellixity.semantica.model.SemanticModel;

import java.util.Objects;

/**
 * Resolves a bare name to a dimension or metric.
 * <p>
 * First match wins, in this order:
 * <ol>
 *   <li>dimension name</li>
 *   <li>metric name</li>
 *   <li>a dimension whose raw {@code sql} equals the name</li>
 *   <li>a metric whose raw {@code sql} equals the name</li>
 * </ol>
 * Dimensions therefore win every collision with a metric, so a filter on such a name lands in
 * WHERE rather than HAVING.
 */
public final class FieldResolver {
  private final SemanticModel model;

  public FieldResolver(SemanticModel model) {
    this.model = Objects.requireNonNull(model, "model");
  }

  public ResolvedField resolve(String name) {
    if (name == null) return ResolvedField.none();

    DimensionDefinition d = model.dimension(name);
    if (d != null) return ResolvedField.of(d);

    MetricDefinition m = model.metric(name);
    if (m != null) return ResolvedField.of(m);

    for (DimensionDefinition dd : model.dimensions()) {
      if (dd.sql().equals(name)) return ResolvedField.of(dd);
    }
    for (MetricDefinition mm : model.metrics()) {
      if (mm.sql().equals(name)) return ResolvedField.of(mm);
    }
    return ResolvedField.none();
  }
}

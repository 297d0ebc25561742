package io.intellixity.semantica.sql.clause;

import io.intellixity.semantica.model.DimensionDefinition;
import io.intellixity.semantica.model.MetricDefinition;
import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.FilterClause;
import io.intellixity.semantica.query.OrderBy;
import io.intellixity.semantica.query.SemanticQueryException;
import io.intellixity.semantica.sql.resolve.FieldResolver;
import io.intellixity.semantica.sql.resolve.ResolvedField;

import java.util.*;

/**
 * Builds the individual clause fragments of a compiled query.
 * <p>
 * Assumes names were already checked by the table requirement pass; a name that no longer
 * resolves here is still reported with the matching error kind.
 */
public final class ClauseBuilder {
  private final SemanticModel model;
  private final FieldResolver fields;
  private final TimeGrainTransformer grains;

  public ClauseBuilder(SemanticModel model, FieldResolver fields, TimeGrainTransformer grains) {
    this.model = Objects.requireNonNull(model, "model");
    this.fields = Objects.requireNonNull(fields, "fields");
    this.grains = Objects.requireNonNull(grains, "grains");
  }

  /** All dimensions, then all metrics, each in request order. */
  public List<String> select(List<String> metrics, List<String> dimensions) {
    List<String> items = new ArrayList<>(dimensions.size() + metrics.size());
    for (String ref : dimensions) {
      items.add(dimensionExpression(ref) + " AS " + ref);
    }
    for (String name : metrics) {
      MetricDefinition m = model.metric(name);
      if (m == null) throw SemanticQueryException.unknownMetric(name);
      items.add(m.sql() + " AS " + m.name());
    }
    return items;
  }

  /**
   * Routes each filter by what its field resolves to: metrics go to HAVING against the metric
   * expression, dimensions go to WHERE against the raw qualified column. Grain suffixes on filter
   * fields are dropped; filters never compare truncated values.
   */
  public FilterPartition filters(List<FilterClause> filters) {
    List<String> where = new ArrayList<>();
    List<String> having = new ArrayList<>();
    for (FilterClause f : filters) {
      ResolvedField rf = fields.resolve(TimeGrainTransformer.baseName(f.field()));
      String literal = SqlLiterals.format(f.value());
      switch (rf.kind()) {
        case METRIC -> having.add(rf.sql() + " " + f.operator() + " " + literal);
        case DIMENSION -> where.add(rf.table() + "." + rf.sql() + " " + f.operator() + " " + literal);
        default -> throw SemanticQueryException.unknownFilterField(f.field());
      }
    }
    return new FilterPartition(where, having);
  }

  /** One expression per requested dimension, matching its SELECT expression; empty without dimensions. */
  public List<String> groupBy(List<String> dimensions) {
    List<String> out = new ArrayList<>(dimensions.size());
    for (String ref : dimensions) out.add(dimensionExpression(ref));
    return out;
  }

  /** {@code <field> ASC|DESC}; the field is not re-resolved. */
  public String orderBy(OrderBy order) {
    String raw = order.direction() == null ? OrderBy.DEFAULT_DIRECTION : order.direction();
    String direction = raw.toUpperCase(Locale.ROOT);
    if (!direction.equals("ASC") && !direction.equals("DESC")) {
      throw SemanticQueryException.invalidOrderDirection(raw);
    }
    return order.field() + " " + direction;
  }

  public String limit(long limit) {
    if (limit < 1) throw SemanticQueryException.invalidLimit(limit);
    return String.valueOf(limit);
  }

  private String dimensionExpression(String ref) {
    String base = TimeGrainTransformer.baseName(ref);
    DimensionDefinition d = model.dimension(base);
    if (d == null) throw SemanticQueryException.unknownDimension(base);
    return grains.expand(ref, d.table(), d.sql());
  }
}

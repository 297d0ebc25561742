package io.intellixity.semantica.sql.resolve;

import io.intellixity.semantica.model.DimensionDefinition;
import io.intellixity.semantica.model.MetricDefinition;
import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.FilterClause;
import io.intellixity.semantica.query.SemanticQueryException;
import io.intellixity.semantica.sql.clause.TimeGrainTransformer;

import java.util.*;

/**
 * Collects the physical tables a query touches and rejects unknown identifiers.
 * <p>
 * This is the only pass that raises UNKNOWN_METRIC, UNKNOWN_DIMENSION and UNKNOWN_FILTER_FIELD;
 * later stages assume every name it accepted resolves. Tables come back in first-seen order
 * (metrics, then dimensions, then filters).
 */
public final class TableRequirementAnalyzer {
  private final SemanticModel model;
  private final FieldResolver fields;

  public TableRequirementAnalyzer(SemanticModel model, FieldResolver fields) {
    this.model = Objects.requireNonNull(model, "model");
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public Set<String> requiredTables(List<String> metrics, List<String> dimensions, List<FilterClause> filters) {
    Set<String> tables = new LinkedHashSet<>();

    for (String name : metrics) {
      MetricDefinition m = model.metric(name);
      if (m == null) throw SemanticQueryException.unknownMetric(name);
      tables.add(m.table());
    }

    for (String ref : dimensions) {
      String base = TimeGrainTransformer.baseName(ref);
      DimensionDefinition d = model.dimension(base);
      if (d == null) throw SemanticQueryException.unknownDimension(base);
      tables.add(d.table());
    }

    for (FilterClause f : filters) {
      ResolvedField rf = fields.resolve(TimeGrainTransformer.baseName(f.field()));
      if (!rf.isResolved()) throw SemanticQueryException.unknownFilterField(f.field());
      tables.add(rf.table());
    }

    return tables;
  }
}

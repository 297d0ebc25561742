package io.intellixity.semantica.sql;

import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.FilterClause;
import io.intellixity.semantica.query.QueryRequest;
import io.intellixity.semantica.query.SemanticQueryException;
import io.intellixity.semantica.sql.clause.ClauseBuilder;
import io.intellixity.semantica.sql.clause.FilterPartition;
import io.intellixity.semantica.sql.clause.TimeGrainTransformer;
import io.intellixity.semantica.sql.resolve.FieldResolver;
import io.intellixity.semantica.sql.resolve.JoinPathResolver;
import io.intellixity.semantica.sql.resolve.TableRequirementAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles {@link QueryRequest}s into SQL against one {@link SemanticModel}.
 * <p>
 * Pipeline per request: metric check, required tables, SELECT, FROM/JOIN, WHERE/HAVING,
 * GROUP BY, ORDER BY, LIMIT. Clauses are joined with newlines in that fixed order; SELECT items
 * are separated by a comma, a newline and seven spaces so they line up under the first item.
 * <p>
 * Instances hold only the immutable model and stateless helpers; they are safe to share across
 * threads.
 */
public final class SemanticSqlCompiler {
  private static final Logger log = LoggerFactory.getLogger(SemanticSqlCompiler.class);

  static final String SELECT_SEPARATOR = ",\n       ";
  static final String CONDITION_SEPARATOR = " AND ";
  static final String GROUP_BY_SEPARATOR = ", ";

  private final SemanticModel model;
  private final TableRequirementAnalyzer tables;
  private final JoinPathResolver joins;
  private final ClauseBuilder clauses;

  public SemanticSqlCompiler(SemanticModel model) {
    this.model = Objects.requireNonNull(model, "model");
    FieldResolver fields = new FieldResolver(model);
    this.tables = new TableRequirementAnalyzer(model, fields);
    this.joins = new JoinPathResolver(model);
    this.clauses = new ClauseBuilder(model, fields, new TimeGrainTransformer());
  }

  public SemanticModel model() { return model; }

  public String compile(QueryRequest request) {
    return plan(request).sql();
  }

  /** Dictionary-shaped request; see {@link QueryRequest#fromMap}. */
  public String compile(Map<String, Object> request) {
    return compile(QueryRequest.fromMap(request));
  }

  public CompiledQuery plan(QueryRequest request) {
    Objects.requireNonNull(request, "request");
    List<String> metrics = request.metrics() == null ? List.of() : request.metrics();
    List<String> dimensions = request.dimensions() == null ? List.of() : request.dimensions();
    List<FilterClause> filters = request.filters() == null ? List.of() : request.filters();

    if (metrics.isEmpty()) throw SemanticQueryException.emptyMetricList();

    Set<String> required = tables.requiredTables(metrics, dimensions, filters);
    String baseTable = model.metric(metrics.get(0)).table();

    List<String> select = clauses.select(metrics, dimensions);
    List<String> joinClauses = joins.resolvePath(baseTable, required);
    FilterPartition partition = clauses.filters(filters);
    List<String> groupBy = clauses.groupBy(dimensions);
    String orderBy = request.orderBy() == null ? null : clauses.orderBy(request.orderBy());
    String limit = request.limit() == null ? null : clauses.limit(request.limit());

    List<String> parts = new ArrayList<>();
    parts.add("SELECT " + String.join(SELECT_SEPARATOR, select));
    parts.add("FROM " + baseTable);
    parts.addAll(joinClauses);
    if (!partition.where().isEmpty()) parts.add("WHERE " + String.join(CONDITION_SEPARATOR, partition.where()));
    if (!groupBy.isEmpty()) parts.add("GROUP BY " + String.join(GROUP_BY_SEPARATOR, groupBy));
    if (!partition.having().isEmpty()) parts.add("HAVING " + String.join(CONDITION_SEPARATOR, partition.having()));
    if (orderBy != null) parts.add("ORDER BY " + orderBy);
    if (limit != null) parts.add("LIMIT " + limit);
    String sql = String.join("\n", parts);

    CompiledQuery compiled = new CompiledQuery(sql, baseTable, required, select, joinClauses,
        partition.where(), groupBy, partition.having(), orderBy, limit);
    debugCompile(metrics, dimensions, compiled);
    return compiled;
  }

  // Shape only: WHERE/HAVING carry inlined filter literals, so neither they nor the SQL text are logged.
  private static void debugCompile(List<String> metrics, List<String> dimensions, CompiledQuery q) {
    if (!log.isDebugEnabled()) return;
    log.debug("semantica.compile metrics={} dimensions={} base={} tables={} joins={} where={} having={} orderBy={} limit={}",
        metrics, dimensions, q.baseTable(), q.requiredTables(), q.joins().size(),
        q.where().size(), q.having().size(), q.orderBy(), q.limit());
  }
}

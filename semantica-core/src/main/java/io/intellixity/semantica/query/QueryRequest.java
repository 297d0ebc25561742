package io.intellixity.semantica.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigInteger;
import java.util.*;

/**
 * A declarative analytics query: metrics to compute, dimensions to group by, filters,
 * optional ordering and an optional row limit.
 * <p>
 * Dimension references may carry a grain suffix ({@code created_at__month}). List order is
 * significant: it drives SELECT, GROUP BY and WHERE/HAVING order in the generated SQL.
 */
@JsonDeserialize(using = QueryRequestJsonDeserializer.class)
public final class QueryRequest {
  private List<String> metrics = new ArrayList<>();
  private List<String> dimensions = new ArrayList<>();
  private List<FilterClause> filters = new ArrayList<>();
  private OrderBy orderBy;
  private Long limit;

  public QueryRequest() {}

  public List<String> metrics() { return metrics; }
  public List<String> dimensions() { return dimensions; }
  public List<FilterClause> filters() { return filters; }
  public OrderBy orderBy() { return orderBy; }
  public Long limit() { return limit; }

  public QueryRequest withMetrics(List<String> metrics) { this.metrics = new ArrayList<>(metrics == null ? List.of() : metrics); return this; }
  public QueryRequest withDimensions(List<String> dimensions) { this.dimensions = new ArrayList<>(dimensions == null ? List.of() : dimensions); return this; }
  public QueryRequest withFilters(List<FilterClause> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public QueryRequest withFilter(FilterClause filter) { this.filters.add(Objects.requireNonNull(filter, "filter")); return this; }
  public QueryRequest withOrderBy(OrderBy orderBy) { this.orderBy = orderBy; return this; }
  public QueryRequest withLimit(Long limit) { this.limit = limit; return this; }
  public QueryRequest withLimit(long limit) { this.limit = limit; return this; }

  public static QueryRequest of(String... metrics) {
    return new QueryRequest().withMetrics(List.of(metrics));
  }

  public QueryRequest by(String... dimensions) {
    return withDimensions(List.of(dimensions));
  }

  /**
   * Builds a request from a dictionary-shaped document ({@code metrics}, {@code dimensions},
   * {@code filters}, {@code order_by}, {@code limit}). A missing {@code metrics} key yields an empty
   * metric list, which the compiler rejects.
   */
  @SuppressWarnings("unchecked")
  public static QueryRequest fromMap(Map<String, Object> m) {
    Objects.requireNonNull(m, "query");
    QueryRequest q = new QueryRequest();
    q.withMetrics(strings(m.get("metrics"), "metrics"));
    q.withDimensions(strings(m.get("dimensions"), "dimensions"));

    Object filters = m.get("filters");
    if (filters != null) {
      if (!(filters instanceof List<?> fl)) throw new IllegalArgumentException("filters must be a list");
      for (Object f : fl) {
        if (!(f instanceof Map<?, ?> fm)) throw new IllegalArgumentException("filter must be an object: " + f);
        q.withFilter(FilterClause.fromMap((Map<String, Object>) fm));
      }
    }

    Object order = m.containsKey("order_by") ? m.get("order_by") : m.get("orderBy");
    if (order != null) {
      if (!(order instanceof Map<?, ?> om)) throw new IllegalArgumentException("order_by must be an object");
      // {} means no ordering
      if (!om.isEmpty()) {
        Object field = om.get("field");
        if (field == null) throw new IllegalArgumentException("order_by requires field");
        Object dir = om.get("direction");
        q.withOrderBy(new OrderBy(String.valueOf(field), dir == null ? null : String.valueOf(dir)));
      }
    }

    if (m.get("limit") != null) q.withLimit(toLimit(m.get("limit")));
    return q;
  }

  /**
   * Accepts integral numbers that fit in a {@code long}; anything else is an
   * {@link SemanticQueryException.Kind#INVALID_LIMIT}. The sign is checked at compile time.
   */
  static Long toLimit(Object v) {
    if (v instanceof Long l) return l;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof BigInteger b && b.bitLength() < 64) return b.longValue();
    throw SemanticQueryException.invalidLimit(v);
  }

  private static List<String> strings(Object o, String key) {
    if (o == null) return List.of();
    if (!(o instanceof List<?> l)) throw new IllegalArgumentException(key + " must be a list");
    List<String> out = new ArrayList<>(l.size());
    for (Object x : l) {
      if (x == null) throw new IllegalArgumentException(key + " must not contain null");
      out.add(String.valueOf(x));
    }
    return out;
  }

  @Override
  public String toString() {
    return "QueryRequest[metrics=" + metrics + ", dimensions=" + dimensions + ", filters=" + filters.size()
        + ", orderBy=" + orderBy + ", limit=" + limit + "]";
  }
}

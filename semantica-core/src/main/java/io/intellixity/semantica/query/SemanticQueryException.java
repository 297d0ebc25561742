package io.intellixity.semantica.query;

import java.util.List;

/**
 * Raised when a query request cannot be compiled against a semantic model.
 * <p>
 * Every failure aborts compilation; {@link #kind()} tells callers which rule was broken.
 */
public final class SemanticQueryException extends RuntimeException {
  public enum Kind {
    EMPTY_METRIC_LIST,
    UNKNOWN_METRIC,
    UNKNOWN_DIMENSION,
    UNKNOWN_FILTER_FIELD,
    UNRESOLVABLE_JOIN,
    INVALID_ORDER_DIRECTION,
    INVALID_LIMIT
  }

  private final Kind kind;
  private final String identifier;
  private final List<String> tables;

  public SemanticQueryException(Kind kind, String message, String identifier, List<String> tables) {
    super(message);
    this.kind = kind;
    this.identifier = identifier;
    this.tables = tables == null ? List.of() : List.copyOf(tables);
  }

  public Kind kind() { return kind; }
  /** The offending metric/dimension/field name, direction or limit text; null when not applicable. */
  public String identifier() { return identifier; }
  /** Tables left unconnected, for {@link Kind#UNRESOLVABLE_JOIN}; empty otherwise. */
  public List<String> tables() { return tables; }

  public static SemanticQueryException emptyMetricList() {
    return new SemanticQueryException(Kind.EMPTY_METRIC_LIST, "Query must contain at least one metric.", null, null);
  }

  public static SemanticQueryException unknownMetric(String name) {
    return new SemanticQueryException(Kind.UNKNOWN_METRIC, "Unknown metric: " + name, name, null);
  }

  public static SemanticQueryException unknownDimension(String name) {
    return new SemanticQueryException(Kind.UNKNOWN_DIMENSION, "Unknown dimension: " + name, name, null);
  }

  public static SemanticQueryException unknownFilterField(String field) {
    return new SemanticQueryException(Kind.UNKNOWN_FILTER_FIELD, "Unknown field in filter: " + field, field, null);
  }

  public static SemanticQueryException unresolvableJoin(List<String> tables) {
    return new SemanticQueryException(Kind.UNRESOLVABLE_JOIN,
        "Cannot resolve joins for tables: " + String.join(", ", tables) + ".", null, tables);
  }

  public static SemanticQueryException invalidOrderDirection(String direction) {
    return new SemanticQueryException(Kind.INVALID_ORDER_DIRECTION,
        "Order by direction must be 'ASC' or 'DESC', got: " + direction, direction, null);
  }

  public static SemanticQueryException invalidLimit(Object limit) {
    String s = String.valueOf(limit);
    return new SemanticQueryException(Kind.INVALID_LIMIT, "Limit must be a positive integer, got: " + s, s, null);
  }
}

package io.intellixity.semantica.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One filter of a query: {@code <field> <operator> <value>}.
 * <p>
 * {@code field} names a dimension or metric (a grain suffix is tolerated and ignored);
 * {@code operator} is a literal SQL token such as {@code =}, {@code >=} or {@code IN};
 * {@code value} is a scalar or a list.
 */
public record FilterClause(String field, String operator, Object value) {
  public FilterClause {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    if (value instanceof List<?> l) value = Collections.unmodifiableList(new ArrayList<>(l));
  }

  public static FilterClause of(String field, String operator, Object value) {
    return new FilterClause(field, operator, value);
  }

  public static FilterClause eq(String field, Object value) { return new FilterClause(field, "=", value); }
  public static FilterClause in(String field, List<?> values) { return new FilterClause(field, "IN", values); }

  public static FilterClause fromMap(Map<String, Object> m) {
    Object field = m.get("field");
    Object op = m.get("operator");
    if (field == null) throw new IllegalArgumentException("filter requires field: " + m);
    if (op == null) throw new IllegalArgumentException("filter requires operator: " + m);
    return new FilterClause(String.valueOf(field), String.valueOf(op), m.get("value"));
  }
}

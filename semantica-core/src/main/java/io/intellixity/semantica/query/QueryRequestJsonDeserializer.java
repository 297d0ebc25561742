package io.intellixity.semantica.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link QueryRequest}. */
public final class QueryRequestJsonDeserializer extends JsonDeserializer<QueryRequest> {
  @Override
  public QueryRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query request JSON must be an object");

    QueryRequest q = new QueryRequest();
    q.withMetrics(textList(root.get("metrics"), "metrics"));
    q.withDimensions(textList(root.get("dimensions"), "dimensions"));

    JsonNode filters = root.get("filters");
    if (filters != null && !filters.isNull()) {
      if (!filters.isArray()) throw new IllegalArgumentException("filters must be an array");
      List<FilterClause> out = new ArrayList<>();
      for (JsonNode f : filters) out.add(parseFilter(f, codec));
      q.withFilters(out);
    }

    JsonNode order = root.has("order_by") ? root.get("order_by") : root.get("orderBy");
    // {} means no ordering
    if (order != null && !order.isNull() && !(order.isObject() && order.isEmpty())) {
      if (!order.isObject()) throw new IllegalArgumentException("order_by must be an object");
      String field = textOrNull(order.get("field"));
      if (field == null) throw new IllegalArgumentException("order_by requires field");
      q.withOrderBy(new OrderBy(field, textOrNull(order.get("direction"))));
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) q.withLimit(parseLimit(limit));

    return q;
  }

  private static FilterClause parseFilter(JsonNode f, ObjectCodec codec) throws IOException {
    if (!f.isObject()) throw new IllegalArgumentException("filter must be an object: " + f);
    String field = textOrNull(f.get("field"));
    if (field == null) throw new IllegalArgumentException("filter requires field: " + f);
    String op = textOrNull(f.get("operator"));
    if (op == null) throw new IllegalArgumentException("filter requires operator: " + f);
    return new FilterClause(field, op, decodeValue(f.get("value"), codec));
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  // 10 and 10.0 differ here: only integral JSON numbers are limits.
  private static Long parseLimit(JsonNode n) {
    if (n.isIntegralNumber() && n.canConvertToLong()) return n.longValue();
    throw SemanticQueryException.invalidLimit(n.isTextual() ? n.asText() : n.toString());
  }

  private static List<String> textList(JsonNode n, String key) {
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) throw new IllegalArgumentException(key + " must be an array");
    List<String> out = new ArrayList<>();
    for (JsonNode x : n) {
      if (!x.isTextual()) throw new IllegalArgumentException(key + " entries must be strings: " + x);
      out.add(x.asText());
    }
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}

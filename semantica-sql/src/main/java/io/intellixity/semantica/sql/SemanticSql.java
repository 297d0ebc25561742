package io.intellixity.semantica.sql;

import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.QueryRequest;

import java.util.Map;

/** One-shot helpers for callers that compile a single request against a model. */
public final class SemanticSql {
  private SemanticSql() {}

  public static String generateSql(SemanticModel model, QueryRequest request) {
    return new SemanticSqlCompiler(model).compile(request);
  }

  /** Both arguments in their dictionary form, as parsed from JSON/YAML. */
  public static String generateSql(Map<String, Object> model, Map<String, Object> request) {
    return generateSql(SemanticModel.fromMap(model), QueryRequest.fromMap(request));
  }
}

package io.intellixity.semantica.model;

import java.util.Map;

final class ModelChecks {
  private ModelChecks() {}

  static String requireText(String v, String kind, String attribute, String owner) {
    if (v == null || v.isBlank()) {
      throw new IllegalArgumentException(kind + "." + attribute + " is required (" + kind + " '" + owner + "')");
    }
    return v;
  }

  static String text(Map<String, Object> m, String key) {
    Object v = m.get(key);
    return v == null ? null : String.valueOf(v);
  }
}

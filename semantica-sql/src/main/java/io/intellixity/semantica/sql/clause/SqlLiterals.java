package io.intellixity.semantica.sql.clause;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Renders filter values as SQL literals. */
public final class SqlLiterals {
  private SqlLiterals() {}

  /**
   * Strings are single-quoted (embedded quotes doubled); collections and object arrays become
   * {@code (a,b,c)}; numbers render as plain decimal text; booleans as TRUE/FALSE; null as NULL.
   */
  public static String format(Object value) {
    if (value instanceof Collection<?> c) return list(c);
    if (value instanceof Object[] a) return list(Arrays.asList(a));
    return scalar(value);
  }

  static String scalar(Object v) {
    if (v == null) return "NULL";
    if (v instanceof CharSequence cs) return quote(cs.toString());
    if (v instanceof Character ch) return quote(String.valueOf(ch));
    if (v instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (v instanceof BigDecimal bd) return bd.toPlainString();
    if (v instanceof Number n) return String.valueOf(n);
    // Enums, dates and the like: quoted textual form.
    return quote(String.valueOf(v));
  }

  private static String list(Collection<?> values) {
    List<String> parts = new ArrayList<>(values.size());
    for (Object v : values) parts.add(scalar(v));
    return "(" + String.join(",", parts) + ")";
  }

  private static String quote(String s) {
    return "'" + s.replace("'", "''") + "'";
  }
}

package io.intellixity.semantica.sql.clause;

/**
 * Rewrites dimension references into SQL column expressions.
 * <p>
 * A reference containing {@code __week}, {@code __month} or {@code __year} (checked in that order)
 * becomes {@code DATE_TRUNC(<table>.<column>, <GRAIN>)}; anything else is the plain qualified
 * column. SELECT and GROUP BY both go through {@link #expand} so their expressions match.
 */
public final class TimeGrainTransformer {
  public static final String SUFFIX_SEPARATOR = "__";

  private static final Grain[] PRIORITY = { Grain.WEEK, Grain.MONTH, Grain.YEAR };

  public String expand(String reference, String table, String rawSql) {
    String column = table + "." + rawSql;
    Grain g = grainOf(reference);
    return g == null ? column : "DATE_TRUNC(" + column + ", " + g.name() + ")";
  }

  /** First grain marker found in the reference, or null. */
  public static Grain grainOf(String reference) {
    if (reference == null) return null;
    for (Grain g : PRIORITY) {
      if (reference.contains(g.marker())) return g;
    }
    return null;
  }

  /** The text before the first {@code __}; the whole reference if there is none. */
  public static String baseName(String reference) {
    int i = reference.indexOf(SUFFIX_SEPARATOR);
    return i < 0 ? reference : reference.substring(0, i);
  }
}

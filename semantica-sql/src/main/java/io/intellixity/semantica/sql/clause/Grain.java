package io.intellixity.semantica.sql.clause;

import java.util.Locale;

/** Date truncation grains a dimension reference may request via a {@code __<grain>} suffix. */
public enum Grain {
  WEEK,
  MONTH,
  YEAR;

  /** The marker searched for in a reference, e.g. {@code __month}. */
  public String marker() {
    return "__" + name().toLowerCase(Locale.ROOT);
  }
}

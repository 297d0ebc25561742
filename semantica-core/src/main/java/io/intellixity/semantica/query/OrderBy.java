package io.intellixity.semantica.query;

import java.util.Objects;

/**
 * Requested ordering. {@code field} is emitted verbatim; {@code direction} is kept as given and
 * checked at compile time (ASC or DESC, case-insensitive).
 */
public record OrderBy(String field, String direction) {
  public static final String DEFAULT_DIRECTION = "ASC";

  public OrderBy {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? DEFAULT_DIRECTION : direction;
  }

  public static OrderBy asc(String field) { return new OrderBy(field, "ASC"); }
  public static OrderBy desc(String field) { return new OrderBy(field, "DESC"); }
}

package io.intellixity.semantica.model;

import java.util.*;

/**
 * The closed set of metrics, dimensions and join edges a compiler works against.
 *
 * Immutable once built. Declaration order is kept: raw-SQL field matching and join traversal
 * both walk definitions in the order they were declared.
 */
public final class SemanticModel {
  private final List<MetricDefinition> metrics;
  private final List<DimensionDefinition> dimensions;
  private final List<JoinEdge> joins;
  private final Map<String, MetricDefinition> metricsByName;
  private final Map<String, DimensionDefinition> dimensionsByName;

  public SemanticModel(List<MetricDefinition> metrics,
                       List<DimensionDefinition> dimensions,
                       List<JoinEdge> joins) {
    this.metrics = metrics == null ? List.of() : List.copyOf(metrics);
    this.dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    this.joins = joins == null ? List.of() : List.copyOf(joins);

    Map<String, MetricDefinition> mm = new LinkedHashMap<>();
    for (MetricDefinition m : this.metrics) {
      if (mm.putIfAbsent(m.name(), m) != null) throw new IllegalArgumentException("Duplicate metric: " + m.name());
    }
    Map<String, DimensionDefinition> dm = new LinkedHashMap<>();
    for (DimensionDefinition d : this.dimensions) {
      if (dm.putIfAbsent(d.name(), d) != null) throw new IllegalArgumentException("Duplicate dimension: " + d.name());
    }
    this.metricsByName = Collections.unmodifiableMap(mm);
    this.dimensionsByName = Collections.unmodifiableMap(dm);
  }

  public List<MetricDefinition> metrics() { return metrics; }
  public List<DimensionDefinition> dimensions() { return dimensions; }
  public List<JoinEdge> joins() { return joins; }

  /** Returns the metric with this exact name, or null. */
  public MetricDefinition metric(String name) { return name == null ? null : metricsByName.get(name); }

  /** Returns the dimension with this exact name, or null. */
  public DimensionDefinition dimension(String name) { return name == null ? null : dimensionsByName.get(name); }

  public boolean hasMetric(String name) { return metric(name) != null; }
  public boolean hasDimension(String name) { return dimension(name) != null; }

  public static Builder builder() { return new Builder(); }

  /**
   * Builds a model from parsed configuration: {@code metrics}, {@code dimensions} and {@code joins}
   * lists of maps. Only {@code metrics} is expected; the other two may be absent.
   */
  public static SemanticModel fromMap(Map<String, Object> config) {
    Objects.requireNonNull(config, "config");
    Builder b = builder();
    for (Map<String, Object> m : listOfMaps(config.get("metrics"), "metrics")) b.metric(MetricDefinition.fromMap(m));
    for (Map<String, Object> m : listOfMaps(config.get("dimensions"), "dimensions")) b.dimension(DimensionDefinition.fromMap(m));
    for (Map<String, Object> m : listOfMaps(config.get("joins"), "joins")) b.join(JoinEdge.fromMap(m));
    return b.build();
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> listOfMaps(Object o, String key) {
    if (o == null) return List.of();
    if (!(o instanceof List<?> l)) throw new IllegalArgumentException(key + " must be a list");
    List<Map<String, Object>> out = new ArrayList<>(l.size());
    for (Object x : l) {
      if (!(x instanceof Map<?, ?> m)) throw new IllegalArgumentException(key + " entries must be objects: " + x);
      out.add((Map<String, Object>) m);
    }
    return out;
  }

  @Override
  public String toString() {
    return "SemanticModel[metrics=" + metricsByName.keySet() + ", dimensions=" + dimensionsByName.keySet()
        + ", joins=" + joins.size() + "]";
  }

  public static final class Builder {
    private final List<MetricDefinition> metrics = new ArrayList<>();
    private final List<DimensionDefinition> dimensions = new ArrayList<>();
    private final List<JoinEdge> joins = new ArrayList<>();

    private Builder() {}

    public Builder metric(MetricDefinition m) { metrics.add(Objects.requireNonNull(m, "metric")); return this; }
    public Builder metric(String name, String table, String sql) { return metric(new MetricDefinition(name, table, sql)); }

    public Builder dimension(DimensionDefinition d) { dimensions.add(Objects.requireNonNull(d, "dimension")); return this; }
    public Builder dimension(String name, String table, String sql) { return dimension(new DimensionDefinition(name, table, sql)); }

    public Builder join(JoinEdge j) { joins.add(Objects.requireNonNull(j, "join")); return this; }
    public Builder join(String one, String many, String on) { return join(new JoinEdge(one, many, on)); }

    /** Appends everything from another model, keeping its declaration order. */
    public Builder addAll(SemanticModel other) {
      metrics.addAll(other.metrics());
      dimensions.addAll(other.dimensions());
      joins.addAll(other.joins());
      return this;
    }

    public SemanticModel build() { return new SemanticModel(metrics, dimensions, joins); }
  }
}

package io.intellixity.semantica.sql;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantica.model.SemanticModel;
import io.intellixity.semantica.query.FilterClause;
import io.intellixity.semantica.query.OrderBy;
import io.intellixity.semantica.query.QueryRequest;
import io.intellixity.semantica.query.SemanticQueryException;
import io.intellixity.semantica.query.SemanticQueryException.Kind;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

final class SemanticSqlCompilerTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final SemanticSqlCompiler compiler = new SemanticSqlCompiler(ShopModel.model());

  private static SemanticQueryException failure(SemanticSqlCompiler c, QueryRequest q) {
    return assertThrows(SemanticQueryException.class, () -> c.compile(q));
  }

  @Test
  void truncatesMonthIdenticallyInSelectAndGroupBy() {
    SemanticModel model = SemanticModel.builder()
        .metric("revenue", "orders", "SUM(orders.amount)")
        .dimension("created_at", "orders", "created_at")
        .build();

    String sql = new SemanticSqlCompiler(model).compile(QueryRequest.of("revenue").by("created_at__month"));

    assertEquals("""
        SELECT DATE_TRUNC(orders.created_at, MONTH) AS created_at__month,
               SUM(orders.amount) AS revenue
        FROM orders
        GROUP BY DATE_TRUNC(orders.created_at, MONTH)""", sql);
  }

  @Test
  void singleTableMetricsOnly() {
    String sql = compiler.compile(QueryRequest.of("revenue", "order_count"));

    assertEquals("""
        SELECT SUM(orders.amount) AS revenue,
               COUNT(orders.id) AS order_count
        FROM orders""", sql);
    assertFalse(sql.contains("JOIN"));
    assertFalse(sql.contains("GROUP BY"));
  }

  @Test
  void assemblesEveryClauseInFixedOrder() {
    QueryRequest q = QueryRequest.of("revenue")
        .by("country", "created_at__month")
        .withFilter(FilterClause.eq("status", "completed"))
        .withFilter(FilterClause.of("revenue", ">", 1000))
        .withFilter(FilterClause.of("created_at", ">=", "2024-01-01"))
        .withOrderBy(new OrderBy("revenue", "desc"))
        .withLimit(10);

    assertEquals("""
        SELECT customers.country AS country,
               DATE_TRUNC(orders.created_at, MONTH) AS created_at__month,
               SUM(orders.amount) AS revenue
        FROM orders
        JOIN customers ON customers.id = orders.customer_id
        WHERE orders.status = 'completed' AND orders.created_at >= '2024-01-01'
        GROUP BY customers.country, DATE_TRUNC(orders.created_at, MONTH)
        HAVING SUM(orders.amount) > 1000
        ORDER BY revenue DESC
        LIMIT 10""", compiler.compile(q));
  }

  @Test
  void joinsFromEitherSideOfTheEdge() {
    String fromCustomers = compiler.compile(QueryRequest.of("customer_count").by("status"));
    String fromOrders = compiler.compile(QueryRequest.of("order_count").by("country"));

    assertEquals("""
        SELECT orders.status AS status,
               COUNT(DISTINCT customers.id) AS customer_count
        FROM customers
        JOIN orders ON customers.id = orders.customer_id
        GROUP BY orders.status""", fromCustomers);
    assertTrue(fromOrders.contains("FROM orders\nJOIN customers ON customers.id = orders.customer_id\n"));
  }

  @Test
  void chainsJoinsAcrossThreeTables() {
    QueryRequest q = QueryRequest.of("revenue", "total_quantity")
        .by("category")
        .withFilter(FilterClause.in("status", List.of("completed", "shipped")));

    assertEquals("""
        SELECT products.category AS category,
               SUM(orders.amount) AS revenue,
               SUM(order_items.quantity) AS total_quantity
        FROM orders
        JOIN order_items ON orders.id = order_items.order_id
        JOIN products ON products.id = order_items.product_id
        WHERE orders.status IN ('completed','shipped')
        GROUP BY products.category""", compiler.compile(q));
  }

  @Test
  void unreachableTableFailsNamingIt() {
    SemanticQueryException ex = failure(compiler, QueryRequest.of("ticket_count", "revenue"));

    assertEquals(Kind.UNRESOLVABLE_JOIN, ex.kind());
    assertEquals(List.of("orders"), ex.tables());
  }

  @Test
  void metricFilterNeverLandsInWhere() {
    String sql = compiler.compile(QueryRequest.of("revenue").withFilter(FilterClause.of("order_count", ">", 5)));

    assertEquals("""
        SELECT SUM(orders.amount) AS revenue
        FROM orders
        HAVING COUNT(orders.id) > 5""", sql);
  }

  @Test
  void dimensionFilterUsesRawColumnEvenWhenGrainRequested() {
    String sql = compiler.compile(QueryRequest.of("revenue")
        .by("created_at__year")
        .withFilter(FilterClause.of("created_at__year", ">=", "2023-01-01")));

    assertTrue(sql.contains("\nWHERE orders.created_at >= '2023-01-01'\n"));
    assertTrue(sql.contains("\nGROUP BY DATE_TRUNC(orders.created_at, YEAR)"));
  }

  @Test
  void orderDirectionDefaultsToAscending() {
    String sql = compiler.compile(QueryRequest.of("revenue").by("status").withOrderBy(new OrderBy("status", null)));
    assertTrue(sql.endsWith("\nORDER BY status ASC"));
  }

  @Test
  void emptyOrMissingMetricsFail() {
    assertEquals(Kind.EMPTY_METRIC_LIST, failure(compiler, new QueryRequest().by("status")).kind());
    assertEquals(Kind.EMPTY_METRIC_LIST,
        assertThrows(SemanticQueryException.class, () -> compiler.compile(Map.of("dimensions", List.of("status")))).kind());
  }

  @Test
  void invalidDirectionAndLimitFail() {
    assertEquals(Kind.INVALID_ORDER_DIRECTION,
        failure(compiler, QueryRequest.of("revenue").withOrderBy(new OrderBy("revenue", "sideways"))).kind());
    assertEquals(Kind.INVALID_LIMIT, failure(compiler, QueryRequest.of("revenue").withLimit(0)).kind());
    assertEquals(Kind.INVALID_LIMIT,
        assertThrows(SemanticQueryException.class,
            () -> compiler.compile(Map.of("metrics", List.of("revenue"), "limit", "ten"))).kind());
  }

  @Test
  void unknownIdentifiersFailBeforeLaterStages() {
    QueryRequest q = QueryRequest.of("revenue", "margin")
        .withOrderBy(new OrderBy("revenue", "sideways"))
        .withLimit(0);
    assertEquals(Kind.UNKNOWN_METRIC, failure(compiler, q).kind());

    assertEquals(Kind.UNKNOWN_DIMENSION, failure(compiler, QueryRequest.of("revenue").by("region")).kind());
    assertEquals(Kind.UNKNOWN_FILTER_FIELD,
        failure(compiler, QueryRequest.of("revenue").withFilter(FilterClause.eq("region", "EU"))).kind());
  }

  @Test
  void largeLimitIsEmittedVerbatim() throws Exception {
    QueryRequest q = JSON.readValue("{ \"metrics\": [\"revenue\"], \"order_by\": {}, \"limit\": 3000000000 }",
        QueryRequest.class);

    assertEquals("""
        SELECT SUM(orders.amount) AS revenue
        FROM orders
        LIMIT 3000000000""", compiler.compile(q));
  }

  @Test
  void planExposesFragments() {
    CompiledQuery plan = compiler.plan(QueryRequest.of("order_count")
        .by("country")
        .withFilter(FilterClause.of("order_count", ">", 1))
        .withLimit(3));

    assertEquals("orders", plan.baseTable());
    assertEquals(List.of("orders", "customers"), List.copyOf(plan.requiredTables()));
    assertEquals(List.of("JOIN customers ON customers.id = orders.customer_id"), plan.joins());
    assertEquals(List.of("customers.country"), plan.groupBy());
    assertEquals(List.of("COUNT(orders.id) > 1"), plan.having());
    assertTrue(plan.where().isEmpty());
    assertNull(plan.orderBy());
    assertEquals("3", plan.limit());
    assertEquals(plan.sql(), compiler.compile(QueryRequest.of("order_count")
        .by("country")
        .withFilter(FilterClause.of("order_count", ">", 1))
        .withLimit(3)));
  }

  @Test
  void jsonRequestCompilesLikeBuiltRequest() throws Exception {
    String json = """
        {
          "metrics": ["revenue"],
          "dimensions": ["country", "created_at__month"],
          "filters": [
            { "field": "status", "operator": "=", "value": "completed" },
            { "field": "revenue", "operator": ">", "value": 1000 },
            { "field": "created_at", "operator": ">=", "value": "2024-01-01" }
          ],
          "order_by": { "field": "revenue", "direction": "DESC" },
          "limit": 10
        }
        """;
    QueryRequest built = QueryRequest.of("revenue")
        .by("country", "created_at__month")
        .withFilter(FilterClause.eq("status", "completed"))
        .withFilter(FilterClause.of("revenue", ">", 1000))
        .withFilter(FilterClause.of("created_at", ">=", "2024-01-01"))
        .withOrderBy(OrderBy.desc("revenue"))
        .withLimit(10);

    String a = compiler.compile(JSON.readValue(json, QueryRequest.class));
    String b = compiler.compile(built);
    String c = compiler.compile(built);
    assertEquals(a, b);
    assertEquals(b, c);
  }

  @Test
  void oneShotHelperAcceptsDictionaries() {
    Map<String, Object> model = new LinkedHashMap<>();
    model.put("metrics", List.of(Map.of("name", "revenue", "table", "orders", "sql", "SUM(orders.amount)")));
    model.put("dimensions", List.of(Map.of("name", "country", "table", "customers", "sql", "country")));
    model.put("joins", List.of(Map.of("one", "customers", "many", "orders", "join", "customers.id = orders.customer_id")));

    Map<String, Object> query = new LinkedHashMap<>();
    query.put("metrics", List.of("revenue"));
    query.put("dimensions", List.of("country"));
    query.put("order_by", Map.of("field", "revenue", "direction", "desc"));
    query.put("limit", 5);

    assertEquals("""
        SELECT customers.country AS country,
               SUM(orders.amount) AS revenue
        FROM orders
        JOIN customers ON customers.id = orders.customer_id
        GROUP BY customers.country
        ORDER BY revenue DESC
        LIMIT 5""", SemanticSql.generateSql(model, query));
  }

  @Test
  void sharedCompilerIsSafeAcrossThreads() throws Exception {
    QueryRequest q = QueryRequest.of("revenue", "total_quantity")
        .by("category", "created_at__week")
        .withFilter(FilterClause.eq("country", "DE"))
        .withOrderBy(OrderBy.desc("revenue"));
    String expected = compiler.compile(q);

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> results = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        results.add(pool.submit(() -> compiler.compile(q)));
      }
      for (Future<String> f : results) assertEquals(expected, f.get());
    } finally {
      pool.shutdownNow();
    }
  }
}

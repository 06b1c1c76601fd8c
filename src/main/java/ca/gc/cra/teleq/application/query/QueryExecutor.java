package ca.gc.cra.teleq.application.query;

import ca.gc.cra.teleq.application.json.JsonSupport;
import ca.gc.cra.teleq.application.port.ClockPort;
import ca.gc.cra.teleq.application.port.QueryCache;
import ca.gc.cra.teleq.application.port.QueryTransport;
import ca.gc.cra.teleq.application.port.QueryTransport.QueryRequest;
import ca.gc.cra.teleq.application.port.QueryTransport.TransportResponse;
import ca.gc.cra.teleq.application.telemetry.DependencyCall;
import ca.gc.cra.teleq.application.telemetry.TelemetrySanitizer;
import ca.gc.cra.teleq.application.telemetry.UsageTelemetrySink;
import ca.gc.cra.teleq.config.ResolvedProfile;
import ca.gc.cra.teleq.domain.sanitize.PiiSanitizer;
import ca.gc.cra.teleq.logging.Logs;
import ca.gc.cra.teleq.validation.Strings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs one query for a resolved profile: validate, consult the cache, call the backend on a
 * miss, classify failures, normalize and store the result.
 * <p><strong>Telemetry:</strong> every call to {@link #execute} reports exactly one {@code Kusto} dependency
 * through the usage telemetry sink, whatever the outcome. The query text is never reported.</p>
 * <p><strong>Endpoint:</strong> {@code <baseUrl>/v1/apps/<applicationInsightsAppId>/query}. The profile's
 * {@code kustoClusterUrl} is informational; requests always go to the configured base URL.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

  /** Public query API used when no base URL is configured. */
  public static final String DEFAULT_BASE_URL = "https://api.applicationinsights.io";
  static final String DEPENDENCY_NAME = "Kusto";
  static final String DEFAULT_QUERY_NAME = "AdHocQuery";
  private static final int MAX_ERROR_BYTES = 512;

  private final QueryTransport transport;
  private final Function<ResolvedProfile, QueryCache> caches;
  private final UsageTelemetrySink telemetry;
  private final ClockPort clock;
  private final String baseUrl;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates an executor.
   *
   * @param transport HTTP transport
   * @param caches returns the cache for a profile's workspace
   * @param telemetry usage telemetry, normally a {@code UsageTelemetryGate}
   * @param clock time source for durations
   * @param baseUrl API base URL; {@code null} selects {@link #DEFAULT_BASE_URL}
   */
  public QueryExecutor(
      QueryTransport transport,
      Function<ResolvedProfile, QueryCache> caches,
      UsageTelemetrySink telemetry,
      ClockPort clock,
      String baseUrl) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.caches = Objects.requireNonNull(caches, "caches");
    this.telemetry = telemetry == null ? UsageTelemetrySink.NO_OP : telemetry;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    String base = Strings.firstNonBlank(baseUrl, DEFAULT_BASE_URL);
    this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  /**
   * Executes a query without a row limit.
   *
   * @param profile resolved profile
   * @param query query text
   * @param accessToken bearer token
   * @param correlationId caller correlation id; may be {@code null}
   * @return normalized result
   * @throws QueryException when the query is rejected or fails
   */
  public QueryResult execute(ResolvedProfile profile, String query, String accessToken, String correlationId) {
    return execute(profile, query, accessToken, correlationId, 0, null);
  }

  /**
   * Executes a query.
   *
   * @param profile resolved profile
   * @param query query text
   * @param accessToken bearer token
   * @param correlationId caller correlation id; may be {@code null}
   * @param rowLimit maximum rows returned; {@code 0} for unlimited
   * @param queryName non-sensitive label reported to telemetry; may be {@code null}
   * @return normalized result
   * @throws QueryException when the query is rejected or fails
   * @throws IllegalArgumentException when the profile has no application id or arguments are invalid
   */
  public QueryResult execute(
      ResolvedProfile profile,
      String query,
      String accessToken,
      String correlationId,
      int rowLimit,
      String queryName) {
    Objects.requireNonNull(profile, "profile");
    if (rowLimit < 0) {
      throw new IllegalArgumentException("rowLimit must not be negative");
    }
    String appId = Strings.trimToNull(profile.applicationInsightsAppId());
    if (appId == null) {
      throw new IllegalArgumentException(
          "Profile '" + profile.name() + "' has no applicationInsightsAppId; run 'teleq validate'");
    }
    String url = baseUrl + "/v1/apps/" + appId + "/query";
    Outcome outcome = new Outcome(correlationId, queryName);
    long start = clock.nowMillis();
    try {
      QueryResult result = run(profile, query, accessToken, rowLimit, url, outcome);
      outcome.success = true;
      return result;
    } catch (QueryException ex) {
      outcome.errorCategory = ex.kind().category();
      if (ex.httpStatus() > 0) {
        outcome.resultCode = Integer.toString(ex.httpStatus());
      }
      throw ex;
    } finally {
      long duration = Math.max(0, clock.nowMillis() - start);
      telemetry.trackDependency(outcome.toCall(url, duration));
    }
  }

  private QueryResult run(
      ResolvedProfile profile, String query, String accessToken, int rowLimit, String url, Outcome outcome) {
    List<String> problems = QueryValidator.validate(query);
    if (!problems.isEmpty()) {
      throw new QueryException(QueryException.Kind.INVALID_QUERY, String.join("; ", problems));
    }
    String token = Strings.trimToNull(accessToken);
    if (token == null) {
      throw new QueryException(QueryException.Kind.AUTHENTICATION_ERROR, "No access token supplied");
    }

    QueryCache cache = profile.cacheEnabled() ? caches.apply(profile) : null;
    // redacted and raw results of the same query are cached apart
    String scope = profile.identity() + (profile.removePii() ? "|pii-redacted" : "|pii-raw");
    String fingerprint = QueryFingerprint.of(scope, query, rowLimit);
    if (cache != null) {
      Optional<QueryResult> hit = cache.get(fingerprint).flatMap(entry -> QueryResult.fromCached(entry.data()));
      if (hit.isPresent()) {
        log.debug("Cache hit for query {} on profile {}", fingerprint.substring(0, 12), profile.name());
        outcome.cacheHit = true;
        outcome.resultCode = "200";
        return hit.get();
      }
    }

    TransportResponse response;
    try {
      response = transport.post(new QueryRequest(url, token, json.write(Map.of("query", query))));
    } catch (IOException ex) {
      throw new QueryException(QueryException.Kind.TRANSPORT_ERROR,
          "Query request failed: " + TelemetrySanitizer.sanitizeErrorMessage(ex.getMessage()), 0, ex);
    }
    outcome.resultCode = Integer.toString(response.status());
    if (!response.isSuccessful()) {
      throw classify(response);
    }

    QueryResult result = normalize(response.body(), rowLimit);
    if (profile.removePii()) {
      result = sanitize(result);
    }
    if (cache != null) {
      try {
        cache.put(fingerprint, result.toMap(), profile.cacheTtlSeconds());
      } catch (UncheckedIOException ex) {
        log.warn("Failed to cache query result for profile {}: {}", profile.name(), ex.getMessage());
      }
    }
    log.debug("Query on profile {} returned {} rows", profile.name(), result.rows().size());
    return result;
  }

  QueryException classify(TransportResponse response) {
    int status = response.status();
    String detail = Logs.truncate(TelemetrySanitizer.sanitizeErrorMessage(errorMessage(response)), MAX_ERROR_BYTES);
    if (status == 400) {
      return new QueryException(QueryException.Kind.INVALID_QUERY, "Invalid query: " + detail, status, null);
    }
    if (status == 401 || status == 403) {
      return new QueryException(QueryException.Kind.AUTHENTICATION_ERROR,
          "Authentication failed: " + detail + ". Check your credentials and permissions.", status, null);
    }
    if (status == 429) {
      return new QueryException(QueryException.Kind.RATE_LIMIT_EXCEEDED,
          "Rate limit exceeded: " + detail + ". Please try again later.", status, null);
    }
    return new QueryException(QueryException.Kind.UNKNOWN, "Query execution failed: " + detail, status, null);
  }

  private String errorMessage(TransportResponse response) {
    String body = response.body();
    if (!body.isBlank()) {
      try {
        Object parsed = json.parse(body);
        if (parsed instanceof Map<?, ?> root && root.get("error") instanceof Map<?, ?> error
            && error.get("message") != null) {
          return error.get("message").toString();
        }
      } catch (IllegalArgumentException ex) {
        log.debug("Error response body is not JSON");
      }
      return body.trim();
    }
    return "HTTP " + response.status();
  }

  QueryResult normalize(String body, int rowLimit) {
    Object parsed;
    try {
      parsed = json.parse(body);
    } catch (IllegalArgumentException ex) {
      throw new QueryException(QueryException.Kind.UNKNOWN, "Query response is not valid JSON", 200, ex);
    }
    if (!(parsed instanceof Map<?, ?> root) || !(root.get("tables") instanceof List<?> tables)
        || tables.isEmpty()) {
      return new QueryResult(List.of(), List.of(), "No results returned", false);
    }
    if (!(tables.get(0) instanceof Map<?, ?> table)) {
      throw new QueryException(QueryException.Kind.UNKNOWN, "Query response table has an unexpected shape", 200, null);
    }
    List<String> columns = new ArrayList<>();
    if (table.get("columns") instanceof List<?> rawColumns) {
      for (Object column : rawColumns) {
        columns.add(columnName(column));
      }
    }
    List<List<Object>> rows = new ArrayList<>();
    if (table.get("rows") instanceof List<?> rawRows) {
      for (Object row : rawRows) {
        rows.add(row instanceof List<?> cells ? new ArrayList<>(cells) : List.of(row));
      }
    }
    int total = rows.size();
    if (rowLimit > 0 && total > rowLimit) {
      rows = new ArrayList<>(rows.subList(0, rowLimit));
    }
    String summary = "Returned " + rows.size() + " row(s) with " + columns.size() + " column(s)";
    if (rows.size() < total) {
      summary += " (limited from " + total + ")";
    }
    return new QueryResult(columns, rows, summary, false);
  }

  private static String columnName(Object column) {
    if (column instanceof Map<?, ?> map) {
      Object name = map.get("name");
      if (name == null) {
        name = map.get("columnName");
      }
      return name == null ? "" : name.toString();
    }
    return String.valueOf(column);
  }

  private static QueryResult sanitize(QueryResult result) {
    List<List<Object>> rows = new ArrayList<>(result.rows().size());
    for (List<Object> row : result.rows()) {
      List<Object> cells = new ArrayList<>(row.size());
      for (Object cell : row) {
        cells.add(PiiSanitizer.sanitizeValue(cell));
      }
      rows.add(cells);
    }
    return new QueryResult(result.columns(), rows, result.summary(), result.cached());
  }

  private static final class Outcome {
    private final String correlationId;
    private final String queryName;
    private boolean success;
    private boolean cacheHit;
    private String resultCode = "error";
    private String errorCategory;

    private Outcome(String correlationId, String queryName) {
      this.correlationId = Strings.firstNonBlank(correlationId, "unknown");
      this.queryName = Strings.firstNonBlank(queryName, DEFAULT_QUERY_NAME);
    }

    private DependencyCall toCall(String url, long durationMillis) {
      Map<String, String> properties = new LinkedHashMap<>();
      properties.put("component", "teleq");
      properties.put("correlationId", correlationId);
      properties.put("cacheHit", Boolean.toString(cacheHit));
      properties.put("queryName", queryName);
      if (!success) {
        properties.put("errorCategory", errorCategory == null ? QueryException.Kind.UNKNOWN.category() : errorCategory);
      }
      return new DependencyCall(DEPENDENCY_NAME, url, durationMillis, success, resultCode, properties);
    }
  }
}

package ca.gc.cra.teleq.application.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized primary table of a query response.
 *
 * @param columns column names in response order
 * @param rows row values, each aligned with {@code columns}
 * @param summary human-readable description of the result size
 * @param cached whether the result came from the query cache
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, String summary, boolean cached) {

  /** Copies components into unmodifiable lists. */
  public QueryResult {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    List<List<Object>> copy = new ArrayList<>(Objects.requireNonNull(rows, "rows").size());
    for (List<Object> row : rows) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    rows = Collections.unmodifiableList(copy);
    summary = summary == null ? "" : summary;
  }

  /**
   * Returns a copy with the cache flag set.
   *
   * @param cached new flag
   * @return copy
   */
  public QueryResult withCached(boolean cached) {
    return new QueryResult(columns, rows, summary, cached);
  }

  /**
   * Renders the result in the form stored in the cache.
   *
   * @return mutable map with {@code columns}, {@code rows} and {@code summary}
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("columns", new ArrayList<>(columns));
    List<Object> rowCopies = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      rowCopies.add(new ArrayList<>(row));
    }
    map.put("rows", rowCopies);
    map.put("summary", summary);
    return map;
  }

  /**
   * Reads a cached result.
   *
   * @param data value previously produced by {@link #toMap()}
   * @return result flagged as cached, or empty when the shape does not match
   */
  public static Optional<QueryResult> fromCached(Object data) {
    if (!(data instanceof Map<?, ?> map)
        || !(map.get("columns") instanceof List<?> columns)
        || !(map.get("rows") instanceof List<?> rows)) {
      return Optional.empty();
    }
    List<String> names = new ArrayList<>(columns.size());
    for (Object column : columns) {
      names.add(String.valueOf(column));
    }
    List<List<Object>> values = new ArrayList<>(rows.size());
    for (Object row : rows) {
      if (!(row instanceof List<?> cells)) {
        return Optional.empty();
      }
      values.add(new ArrayList<>(cells));
    }
    Object summary = map.get("summary");
    return Optional.of(new QueryResult(names, values, summary == null ? null : summary.toString(), true));
  }
}

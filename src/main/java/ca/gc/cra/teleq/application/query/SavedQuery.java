package ca.gc.cra.teleq.application.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> A query saved as a {@code .kql} file with a comment header.
 * <p><strong>Format:</strong></p>
 * <pre>
 * // Query: Failed requests by operation
 * // Category: Monitoring
 * // Purpose: Find the noisiest failing operations
 * // Use case: Morning health check
 * // Created: 2024-05-01
 * // Tags: errors, requests
 *
 * requests | where success == false | summarize count() by operation_Name
 * </pre>
 * <p>The header is the run of leading {@code //} lines; the query text is everything after it. The category is
 * taken from the first folder below the queries folder, not from the header.</p>
 *
 * @param fileName file name including the {@code .kql} suffix
 * @param category first folder below the queries folder, or {@value #ROOT_CATEGORY}
 * @param name display name; the file name when the header has none
 * @param purpose purpose line; empty when absent
 * @param useCase use case line; empty when absent
 * @param created creation date as written; empty when absent
 * @param tags tags in header order
 * @param kql query text without the header
 * @since 0.1.0
 */
public record SavedQuery(
    String fileName,
    String category,
    String name,
    String purpose,
    String useCase,
    String created,
    List<String> tags,
    String kql) {

  /** Category of queries stored directly in the queries folder. */
  public static final String ROOT_CATEGORY = "Root";
  /** File suffix of saved queries. */
  public static final String SUFFIX = ".kql";

  private static final String COMMENT = "//";

  public SavedQuery {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kql, "kql");
    purpose = purpose == null ? "" : purpose;
    useCase = useCase == null ? "" : useCase;
    created = created == null ? "" : created;
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /**
   * Parses file content.
   *
   * @param fileName file name
   * @param category category derived from the file location
   * @param content file content
   * @return parsed query
   * @throws IllegalArgumentException when the file holds no query text
   */
  public static SavedQuery parse(String fileName, String category, String content) {
    Objects.requireNonNull(content, "content");
    String[] lines = content.split("\\R", -1);
    String name = null;
    String purpose = null;
    String useCase = null;
    String created = null;
    List<String> tags = new ArrayList<>();
    int body = lines.length;
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      if (!line.startsWith(COMMENT)) {
        body = i;
        break;
      }
      String comment = line.substring(COMMENT.length()).trim();
      if (comment.startsWith("Query:")) {
        name = value(comment, "Query:");
      } else if (comment.startsWith("Purpose:")) {
        purpose = value(comment, "Purpose:");
      } else if (comment.startsWith("Use case:")) {
        useCase = value(comment, "Use case:");
      } else if (comment.startsWith("Created:")) {
        created = value(comment, "Created:");
      } else if (comment.startsWith("Tags:")) {
        tags = splitTags(value(comment, "Tags:"));
      }
    }
    String kql = String.join("\n", List.of(lines).subList(body, lines.length)).trim();
    if (kql.isEmpty()) {
      throw new IllegalArgumentException("No query text in " + fileName);
    }
    return new SavedQuery(fileName, category, name == null || name.isEmpty() ? fileName : name, purpose, useCase,
        created, tags, kql);
  }

  /**
   * Renders the file content for a query.
   *
   * @param name display name
   * @param category category written to the header; may be {@code null}
   * @param purpose purpose; may be {@code null}
   * @param useCase use case; may be {@code null}
   * @param created creation date
   * @param tags tags; may be empty
   * @param kql query text
   * @return file content
   */
  public static String render(String name, String category, String purpose, String useCase, String created,
      List<String> tags, String kql) {
    List<String> lines = new ArrayList<>();
    lines.add("// Query: " + name);
    if (category != null && !category.isBlank()) {
      lines.add("// Category: " + category);
    }
    if (purpose != null && !purpose.isBlank()) {
      lines.add("// Purpose: " + purpose);
    }
    if (useCase != null && !useCase.isBlank()) {
      lines.add("// Use case: " + useCase);
    }
    lines.add("// Created: " + created);
    if (tags != null && !tags.isEmpty()) {
      lines.add("// Tags: " + String.join(", ", tags));
    }
    lines.add("");
    lines.add(kql);
    return String.join("\n", lines);
  }

  /**
   * Derives a file name from a display name: letters, digits, spaces and hyphens survive, runs of spaces
   * collapse.
   *
   * @param name display name
   * @return file name with the {@code .kql} suffix
   * @throws IllegalArgumentException when nothing usable remains
   */
  public static String fileNameFor(String name) {
    String stem = name == null ? "" : name.replaceAll("[^A-Za-z0-9\\s-]", "").trim().replaceAll("\\s+", " ");
    if (stem.isEmpty()) {
      throw new IllegalArgumentException("Query name must contain letters or digits");
    }
    return stem + SUFFIX;
  }

  /**
   * Scores how well the query matches search terms. Name matches weigh most, then tags, the file name, purpose
   * and use case, and finally the query text.
   *
   * @param terms search terms; matched case-insensitively as substrings
   * @return relevance; {@code 0} when nothing matches
   */
  public int score(List<String> terms) {
    int score = 0;
    for (String term : terms) {
      String needle = term.toLowerCase(Locale.ROOT);
      if (needle.isEmpty()) {
        continue;
      }
      if (contains(name, needle)) {
        score += 10;
      }
      if (contains(purpose, needle)) {
        score += 5;
      }
      if (contains(useCase, needle)) {
        score += 5;
      }
      if (tags.stream().anyMatch(tag -> contains(tag, needle))) {
        score += 8;
      }
      if (contains(fileName, needle)) {
        score += 7;
      }
      if (contains(kql, needle)) {
        score += 3;
      }
    }
    return score;
  }

  private static boolean contains(String haystack, String needle) {
    return haystack.toLowerCase(Locale.ROOT).contains(needle);
  }

  private static String value(String comment, String label) {
    return comment.substring(label.length()).trim();
  }

  /**
   * Splits a comma-separated tag list, dropping blanks.
   *
   * @param text tag list
   * @return tags in order
   */
  public static List<String> splitTags(String text) {
    List<String> tags = new ArrayList<>();
    for (String tag : text.split(",")) {
      String trimmed = tag.trim();
      if (!trimmed.isEmpty()) {
        tags.add(trimmed);
      }
    }
    return tags;
  }
}

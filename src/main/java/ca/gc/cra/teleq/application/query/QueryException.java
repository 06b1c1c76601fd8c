package ca.gc.cra.teleq.application.query;

import java.util.Objects;

/**
 * Raised when a query cannot be executed or the backend rejects it.
 *
 * <p>No kind is retried by the executor. Messages never contain the query text or the bearer token.</p>
 */
public final class QueryException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure categories. */
  public enum Kind {
    /** The query was rejected before or by the backend as malformed (HTTP 400). */
    INVALID_QUERY("InvalidQuery"),
    /** The token was rejected (HTTP 401/403); the caller should re-authenticate. */
    AUTHENTICATION_ERROR("AuthenticationError"),
    /** The backend throttled the caller (HTTP 429). */
    RATE_LIMIT_EXCEEDED("RateLimitExceeded"),
    /** The request never produced an HTTP response. */
    TRANSPORT_ERROR("TransportError"),
    /** Any other outcome. */
    UNKNOWN("Unknown");

    private final String category;

    Kind(String category) {
      this.category = category;
    }

    /**
     * Returns the category name reported to usage telemetry.
     *
     * @return category
     */
    public String category() {
      return category;
    }
  }

  private final Kind kind;
  private final int httpStatus;

  /**
   * Creates an exception.
   *
   * @param kind failure category
   * @param message user-facing message
   * @param httpStatus HTTP status, or {@code 0} when there was no response
   * @param cause underlying failure; may be {@code null}
   */
  public QueryException(Kind kind, String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.httpStatus = httpStatus;
  }

  /**
   * Creates an exception without a response or cause.
   *
   * @param kind failure category
   * @param message user-facing message
   */
  public QueryException(Kind kind, String message) {
    this(kind, message, 0, null);
  }

  /**
   * Returns the failure category.
   *
   * @return kind
   */
  public Kind kind() {
    return kind;
  }

  /**
   * Returns the HTTP status that caused the failure.
   *
   * @return status, or {@code 0} when no response was received
   */
  public int httpStatus() {
    return httpStatus;
  }
}

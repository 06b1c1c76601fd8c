package ca.gc.cra.teleq.application.auth;

import java.util.Objects;

/**
 * Raised when a token cannot be obtained.
 *
 * <p>Each kind tells the caller what the user must do; {@link #remediation()} carries the concrete next step.
 * Messages never contain tokens or secrets.</p>
 */
public final class AuthException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure categories. */
  public enum Kind {
    /** The identity platform or CLI rejected the sign-in. */
    AUTH_FAILED,
    /** Required credentials are missing from the profile. */
    MISSING_CREDENTIALS,
    /** The host process did not inject a token. */
    TOKEN_UNAVAILABLE,
    /** The Azure CLI is not installed or not on the PATH. */
    CLI_NOT_INSTALLED,
    /** The Azure CLI has no signed-in account. */
    CLI_NOT_LOGGED_IN
  }

  private final Kind kind;
  private final String remediation;

  /**
   * Creates an exception.
   *
   * @param kind failure category
   * @param message user-facing message
   * @param remediation suggested next step; may be {@code null}
   */
  public AuthException(Kind kind, String message, String remediation) {
    this(kind, message, remediation, null);
  }

  /**
   * Creates an exception with a cause.
   *
   * @param kind failure category
   * @param message user-facing message
   * @param remediation suggested next step; may be {@code null}
   * @param cause underlying failure
   */
  public AuthException(Kind kind, String message, String remediation, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.remediation = remediation;
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
   * Returns the suggested next step.
   *
   * @return remediation text, or {@code null}
   */
  public String remediation() {
    return remediation;
  }
}

package ca.gc.cra.teleq.config;

import java.util.Objects;

/**
 * Raised when a configuration document cannot be located, parsed, or resolved into a profile.
 *
 * <p>Messages are user-facing and never contain secret values.</p>
 *
 * @since 0.1.0
 */
public final class ConfigException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Failure categories surfaced to callers and mapped to CLI exit codes. */
  public enum Kind {
    /** No candidate location holds a configuration document. */
    CONFIG_NOT_FOUND,
    /** The document exists but is not valid JSON/YAML or has the wrong shape. */
    MALFORMED_CONFIG,
    /** No profile was named and the document has no default. */
    NO_PROFILE_SPECIFIED,
    /** The requested profile, or one of its ancestors, does not exist. */
    PROFILE_NOT_FOUND,
    /** The {@code extends} chain revisits a profile. */
    CIRCULAR_INHERITANCE,
    /** Caller input (profile name, output path) was rejected. */
    INVALID_INPUT,
    /** The document could not be read or written. */
    IO_FAILURE
  }

  private final Kind kind;

  /**
   * Creates an exception without a cause.
   *
   * @param kind failure category
   * @param message user-facing message
   */
  public ConfigException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception wrapping a lower-level failure.
   *
   * @param kind failure category
   * @param message user-facing message
   * @param cause underlying failure
   */
  public ConfigException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return kind; never {@code null}
   */
  public Kind kind() {
    return kind;
  }
}

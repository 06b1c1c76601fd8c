/**
 * Logging configuration and redaction helpers.
 * <p><strong>Role:</strong> Cross-cutting utilities used by the CLI and adapters.</p>
 * <p><strong>Security:</strong> {@link ca.gc.cra.teleq.logging.Logs#redact(String)} is the only way secrets are
 * mentioned in log output.</p>
 */
package ca.gc.cra.teleq.logging;

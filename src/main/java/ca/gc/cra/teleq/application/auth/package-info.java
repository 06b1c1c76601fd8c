/**
 * Token acquisition: per-profile {@link ca.gc.cra.teleq.application.auth.AuthProvider} sessions over a closed set
 * of {@link ca.gc.cra.teleq.application.auth.TokenStrategy} implementations.
 * <p><strong>Security:</strong> Tokens and secrets are redacted from every {@code toString}.</p>
 */
package ca.gc.cra.teleq.application.auth;

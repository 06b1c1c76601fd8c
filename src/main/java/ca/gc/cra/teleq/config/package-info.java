/**
 * Configuration discovery, profile resolution, and process wiring.
 * <p><strong>Resolution:</strong> {@link ca.gc.cra.teleq.config.ConfigStore} loads the raw document;
 * {@link ca.gc.cra.teleq.config.ProfileResolver} walks the {@code extends} chain root-first, deep-merges the
 * layers, applies document defaults, and expands {@code ${VAR}} references into an immutable
 * {@link ca.gc.cra.teleq.config.ResolvedProfile}.</p>
 * <p><strong>Wiring:</strong> {@link ca.gc.cra.teleq.config.CompositionRoot} binds ports to adapters.</p>
 */
package ca.gc.cra.teleq.config;

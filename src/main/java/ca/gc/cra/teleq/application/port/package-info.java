/**
 * Cross-cutting ports shared by the application services.
 * <p><strong>Role:</strong> Interfaces implemented by infrastructure adapters and test doubles.</p>
 */
package ca.gc.cra.teleq.application.port;

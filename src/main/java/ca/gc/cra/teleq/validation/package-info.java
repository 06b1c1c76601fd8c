/**
 * Input validation helpers shared by configuration, auth, and CLI code.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.teleq.validation;

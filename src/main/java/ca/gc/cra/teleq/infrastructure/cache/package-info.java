/**
 * Filesystem adapter for the query cache port.
 */
package ca.gc.cra.teleq.infrastructure.cache;

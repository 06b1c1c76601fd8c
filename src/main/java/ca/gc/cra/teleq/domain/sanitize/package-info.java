/**
 * Personal-data redaction applied to query results when a profile sets {@code removePII}.
 */
package ca.gc.cra.teleq.domain.sanitize;

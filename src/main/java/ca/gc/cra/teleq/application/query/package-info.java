/**
 * Query execution: validation, fingerprinting, caching, failure classification and result normalization.
 */
package ca.gc.cra.teleq.application.query;

/**
 * OkHttp adapter for the query transport port.
 */
package ca.gc.cra.teleq.infrastructure.http;

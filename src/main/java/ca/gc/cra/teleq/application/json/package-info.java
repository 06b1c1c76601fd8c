/**
 * JSON helpers built on the Jackson streaming API.
 */
package ca.gc.cra.teleq.application.json;

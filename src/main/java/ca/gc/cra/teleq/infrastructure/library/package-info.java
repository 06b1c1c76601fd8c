/**
 * Filesystem adapter for the saved query library port.
 */
package ca.gc.cra.teleq.infrastructure.library;

/**
 * External process execution used by CLI-delegated authentication.
 */
package ca.gc.cra.teleq.infrastructure.exec;

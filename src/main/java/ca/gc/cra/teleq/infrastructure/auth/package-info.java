/**
 * Token strategies: Azure CLI, MSAL device code, MSAL client credentials, and host-injected tokens.
 */
package ca.gc.cra.teleq.infrastructure.auth;

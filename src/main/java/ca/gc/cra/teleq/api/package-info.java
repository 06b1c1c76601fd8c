/**
 * Command-line entry points for TELEQ ({@code teleq <command>}).
 * <p>Results print to stdout through {@link ca.gc.cra.teleq.api.CliPrinter}; logs go to stderr. Each command maps
 * failures to an {@link ca.gc.cra.teleq.api.ExitCode}.</p>
 */
package ca.gc.cra.teleq.api;

/**
 * Command-line entry points: the {@code tbfs} dispatcher and its subcommands.
 * <p>Arguments are {@code key=value} pairs plus flags; exit statuses come from
 * {@link ca.gc.cra.tbfs.api.ExitCode}. Records and command results go to stdout, logs to stderr.</p>
 */
package ca.gc.cra.tbfs.api;

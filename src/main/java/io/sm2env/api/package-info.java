/**
 * Command-line adapters: the {@code sm2env} dispatcher and the {@code get} and {@code list} commands.
 *
 * <p>Arguments are {@code key=value} pairs plus {@code --flags}; rendered secrets, listings, and confirmations go to
 * stdout while diagnostics go to stderr through Logback.</p>
 *
 * @since 0.1.0
 */
package io.sm2env.api;

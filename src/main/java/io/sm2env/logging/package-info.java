/**
 * Logging helpers: runtime level control for {@code --verbose} and bounded diagnostic strings.
 *
 * <p>All log output goes to stderr through Logback so stdout carries only secret output.</p>
 *
 * @since 0.1.0
 */
package io.sm2env.logging;

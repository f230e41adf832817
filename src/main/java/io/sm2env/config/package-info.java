/**
 * Configuration for sm2env commands: YAML loading, precedence merging, typed settings, and adapter wiring.
 *
 * <p>Precedence is CLI arguments, then the YAML file named by {@code config=}, then {@link
 * io.sm2env.config.DefaultsForMode}.</p>
 *
 * @since 0.1.0
 */
package io.sm2env.config;

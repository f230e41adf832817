/**
 * Driven-side adapters: AWS Secrets Manager, local output, and OpenTelemetry metrics.
 *
 * @since 0.1.0
 */
package io.sm2env.infrastructure;

/**
 * Ports separating the render engine from the secret store, the filesystem, and metrics backends.
 * <p><strong>Role:</strong> Driven-side interfaces of the hexagonal layout; adapters live under
 * {@code io.sm2env.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> One invocation uses each port from a single thread.</p>
 * <p><strong>Security:</strong> Implementations must not log secret payloads.</p>
 */
package io.sm2env.application.port;

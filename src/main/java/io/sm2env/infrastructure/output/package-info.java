/**
 * Filesystem and console adapter for {@link io.sm2env.application.port.OutputPort}.
 */
package io.sm2env.infrastructure.output;

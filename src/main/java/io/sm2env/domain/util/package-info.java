/**
 * Small encoding utilities shared by the render engine and adapters.
 * <p><strong>Concurrency:</strong> Stateless helpers; safe for concurrent use.</p>
 */
package io.sm2env.domain.util;

/**
 * Use cases driven by the CLI: fetching and rendering one secret, and listing secret names.
 */
package io.sm2env.application.pipeline;

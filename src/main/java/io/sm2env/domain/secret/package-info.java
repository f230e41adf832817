/**
 * Domain types describing fetched secrets, their classified form, and render requests.
 * <p><strong>Role:</strong> Shared vocabulary between the fetch adapters, the render engine, and the CLI.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.</p>
 * <p><strong>Security:</strong> {@code toString()} implementations never include secret contents.</p>
 */
package io.sm2env.domain.secret;

/**
 * Validation helpers used during CLI parsing and configuration bootstrap.
 *
 * <p>Invalid input is rejected with {@link java.lang.IllegalArgumentException} before an AWS client or output file is
 * touched.</p>
 *
 * @since 0.1.0
 */
package io.sm2env.validation;

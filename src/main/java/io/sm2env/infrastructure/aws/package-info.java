/**
 * AWS Secrets Manager adapter for {@link io.sm2env.application.port.SecretSource}.
 */
package io.sm2env.infrastructure.aws;

package io.sm2env.infrastructure.aws;

import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;

/**
 * Builds the Secrets Manager client from CLI and YAML settings.
 *
 * <p>Region and credentials fall back to the SDK's default provider chains when not given. An endpoint override
 * points the client at a local emulator.</p>
 */
public final class SecretsManagerClientFactory {
  private static final Logger log = LoggerFactory.getLogger(SecretsManagerClientFactory.class);

  private SecretsManagerClientFactory() {}

  /**
   * Creates a synchronous client.
   *
   * @param region optional region such as {@code us-east-1}
   * @param profile optional named profile from the shared AWS config files
   * @param endpoint optional endpoint override
   * @return configured client; the caller closes it
   */
  public static SecretsManagerClient create(Optional<String> region, Optional<String> profile,
      Optional<URI> endpoint) {
    SecretsManagerClientBuilder builder = SecretsManagerClient.builder();
    region.ifPresent(r -> builder.region(Region.of(r)));
    builder.credentialsProvider(credentials(profile));
    endpoint.ifPresent(builder::endpointOverride);
    log.debug("Building Secrets Manager client (region={}, profile={}, endpoint={})",
        region.orElse("<default chain>"), profile.orElse("<default>"), endpoint.map(URI::toString).orElse("<aws>"));
    return builder.build();
  }

  static AwsCredentialsProvider credentials(Optional<String> profile) {
    if (profile.isPresent()) {
      return ProfileCredentialsProvider.create(profile.get());
    }
    return DefaultCredentialsProvider.builder().build();
  }
}

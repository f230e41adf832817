package io.sm2env.infrastructure.aws;

import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.port.SecretSource;
import io.sm2env.domain.secret.RawSecret;
import io.sm2env.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsRequest;
import software.amazon.awssdk.services.secretsmanager.model.ListSecretsResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;

/**
 * <strong>What:</strong> {@link SecretSource} backed by AWS Secrets Manager.
 * <p><strong>Role:</strong> Driven-side adapter; the only class that talks to the AWS SDK service client.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return {@code SecretString} as text and {@code SecretBinary} as bytes, untouched.</li>
 *   <li>Follow {@code nextToken} until every page of {@code ListSecrets} has been read.</li>
 *   <li>Map SDK exceptions onto {@link SecretFetchException.Kind}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The SDK client is thread-safe; this adapter holds no other state.</p>
 * <p><strong>Observability:</strong> Logs service error messages at DEBUG, truncated; never secret content.</p>
 *
 * @since 0.1.0
 */
public final class SecretsManagerSecretSource implements SecretSource {
  private static final Logger log = LoggerFactory.getLogger(SecretsManagerSecretSource.class);
  private static final int LIST_PAGE_SIZE = 100;

  private final SecretsManagerClient client;

  public SecretsManagerSecretSource(SecretsManagerClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public RawSecret fetch(String secretName) throws SecretFetchException {
    Objects.requireNonNull(secretName, "secretName");
    GetSecretValueResponse response;
    try {
      response = client.getSecretValue(GetSecretValueRequest.builder().secretId(secretName).build());
    } catch (SdkException ex) {
      throw translate("fetch secret '" + secretName + "'", ex);
    }
    if (response.secretString() != null) {
      return RawSecret.ofText(response.secretString());
    }
    SdkBytes binary = response.secretBinary();
    if (binary != null) {
      return RawSecret.ofBytes(binary.asByteArray());
    }
    throw new SecretFetchException(SecretFetchException.Kind.OTHER,
        "No secret content found for '" + secretName + "'");
  }

  @Override
  public List<String> list(Optional<String> filter) throws SecretFetchException {
    Optional<String> effective = filter == null ? Optional.empty() : filter;
    List<String> names = new ArrayList<>();
    String nextToken = null;
    int pages = 0;
    try {
      do {
        ListSecretsResponse response = client.listSecrets(ListSecretsRequest.builder()
            .maxResults(LIST_PAGE_SIZE)
            .nextToken(nextToken)
            .build());
        pages++;
        for (SecretListEntry entry : response.secretList()) {
          String name = entry.name();
          if (name != null && effective.map(name::contains).orElse(true)) {
            names.add(name);
          }
        }
        nextToken = response.nextToken();
      } while (nextToken != null && !nextToken.isEmpty());
    } catch (SdkException ex) {
      throw translate("list secrets", ex);
    }
    log.debug("ListSecrets returned {} matching names across {} page(s)", names.size(), pages);
    return names;
  }

  @Override
  public void close() {
    client.close();
  }

  static SecretFetchException translate(String action, SdkException ex) {
    String detail = Logs.truncate(ex.getMessage());
    log.debug("Secrets Manager call failed while trying to {}: {}", action, detail);
    if (ex instanceof ResourceNotFoundException) {
      return new SecretFetchException(SecretFetchException.Kind.NOT_FOUND,
          "Secret not found: could not " + action, ex);
    }
    if (ex instanceof SecretsManagerException service && isAccessDenied(service)) {
      return new SecretFetchException(SecretFetchException.Kind.ACCESS_DENIED,
          "Access denied: could not " + action + ": " + detail, ex);
    }
    if (ex instanceof SdkClientException) {
      return new SecretFetchException(SecretFetchException.Kind.NETWORK_ERROR,
          "Network or client error: could not " + action + ": " + detail, ex);
    }
    return new SecretFetchException(SecretFetchException.Kind.OTHER,
        "Could not " + action + ": " + detail, ex);
  }

  private static boolean isAccessDenied(SecretsManagerException ex) {
    if (ex.statusCode() == 403) {
      return true;
    }
    String code = ex.awsErrorDetails() == null ? null : ex.awsErrorDetails().errorCode();
    return "AccessDeniedException".equals(code);
  }
}

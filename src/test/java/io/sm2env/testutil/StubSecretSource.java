package io.sm2env.testutil;

import io.sm2env.application.port.SecretFetchException;
import io.sm2env.application.port.SecretSource;
import io.sm2env.domain.secret.RawSecret;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link SecretSource} backed by a map; names are listed in insertion order.
 */
public final class StubSecretSource implements SecretSource {
  private final Map<String, RawSecret> secrets = new LinkedHashMap<>();
  private SecretFetchException failure;
  private boolean closed;

  public StubSecretSource put(String name, RawSecret secret) {
    secrets.put(name, secret);
    return this;
  }

  public StubSecretSource failWith(SecretFetchException ex) {
    this.failure = ex;
    return this;
  }

  @Override
  public RawSecret fetch(String secretName) throws SecretFetchException {
    if (failure != null) {
      throw failure;
    }
    RawSecret secret = secrets.get(secretName);
    if (secret == null) {
      throw new SecretFetchException(SecretFetchException.Kind.NOT_FOUND, "Secret not found: " + secretName);
    }
    return secret;
  }

  @Override
  public List<String> list(Optional<String> filter) throws SecretFetchException {
    if (failure != null) {
      throw failure;
    }
    List<String> names = new ArrayList<>();
    for (String name : secrets.keySet()) {
      if (filter.map(name::contains).orElse(true)) {
        names.add(name);
      }
    }
    return names;
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean closed() {
    return closed;
  }
}

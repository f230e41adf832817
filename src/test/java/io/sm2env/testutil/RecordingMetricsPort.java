package io.sm2env.testutil;

import io.sm2env.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures counter increments and observations for assertions.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final List<String> increments = new ArrayList<>();
  private final Map<String, List<Long>> observations = new LinkedHashMap<>();

  @Override
  public void increment(String key) {
    increments.add(key);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }

  public List<String> increments() {
    return increments;
  }

  public List<Long> observations(String key) {
    return observations.getOrDefault(key, List.of());
  }
}

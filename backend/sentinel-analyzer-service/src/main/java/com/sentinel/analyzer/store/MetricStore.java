package com.sentinel.analyzer.store;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * The shared time-series store as seen by the analyzer. Everything is read-only except
 * {@link #setIfAbsentWithTtl}, which only the alert cooldown cache uses.
 */
public interface MetricStore {

  /** Throws if the store cannot be reached. */
  void ping();

  Set<String> members(String key);

  /** One entry per requested key, in request order; {@code null} where the key is absent. */
  List<byte[]> bulkGet(List<String> keys);

  /** {@code null} when the key is absent. */
  byte[] get(String key);

  /** SET NX with expiry; {@code false} when the key already exists. */
  boolean setIfAbsentWithTtl(String key, byte[] value, Duration ttl);
}

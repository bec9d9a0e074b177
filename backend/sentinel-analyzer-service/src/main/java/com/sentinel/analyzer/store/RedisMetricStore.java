package com.sentinel.analyzer.store;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
public class RedisMetricStore implements MetricStore {

  private final StringRedisTemplate redis;
  private final RedisTemplate<String, byte[]> series;

  public RedisMetricStore(StringRedisTemplate redis, RedisTemplate<String, byte[]> series) {
    this.redis = redis;
    this.series = series;
  }

  @Override
  public void ping() {
    String reply = redis.execute((RedisCallback<String>) RedisConnection::ping);
    if (reply == null) {
      throw new IllegalStateException("redis did not answer PING");
    }
  }

  @Override
  public Set<String> members(String key) {
    return Optional.ofNullable(redis.opsForSet().members(key)).orElseGet(Set::of);
  }

  @Override
  public List<byte[]> bulkGet(List<String> keys) {
    if (keys.isEmpty()) return List.of();
    List<byte[]> values = series.opsForValue().multiGet(keys);
    if (values == null) {
      // pipelined/transactional templates return null; treat every key as absent
      List<byte[]> absent = new ArrayList<>(keys.size());
      for (int i = 0; i < keys.size(); i++) absent.add(null);
      return absent;
    }
    return values;
  }

  @Override
  public byte[] get(String key) {
    return series.opsForValue().get(key);
  }

  @Override
  public boolean setIfAbsentWithTtl(String key, byte[] value, Duration ttl) {
    return Boolean.TRUE.equals(series.opsForValue().setIfAbsent(key, value, ttl));
  }
}

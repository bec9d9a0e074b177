package com.sentinel.analyzer.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits the metric universe into contiguous slices, one per worker. Each worker gets
 * {@code ceil(total / workers)} items and the last worker runs to the end of the list.
 * Workers whose index exceeds the item count, or whose slice would be empty, get nothing.
 */
public final class WorkerPartitioner {

  private WorkerPartitioner() {}

  /** Half-open range {@code [from, to)} of the universe owned by 1-based {@code worker}. */
  public record Slice(int worker, int from, int to) {
    public int size() {
      return to - from;
    }
  }

  public static Optional<Slice> slice(int worker, int total, int workers) {
    if (workers < 1) throw new IllegalArgumentException("workers must be >= 1 but was " + workers);
    if (worker < 1 || worker > workers) {
      throw new IllegalArgumentException("worker index " + worker + " outside 1.." + workers);
    }
    if (worker > total) return Optional.empty();

    int perWorker = (total + workers - 1) / workers;
    int from = Math.min(total, (worker - 1) * perWorker);
    int to = worker == workers ? total : Math.min(total, worker * perWorker);
    return from < to ? Optional.of(new Slice(worker, from, to)) : Optional.empty();
  }

  public static List<Slice> slices(int total, int workers) {
    List<Slice> out = new ArrayList<>();
    for (int i = 1; i <= Math.min(workers, total); i++) {
      slice(i, total, workers).ifPresent(out::add);
    }
    return out;
  }
}

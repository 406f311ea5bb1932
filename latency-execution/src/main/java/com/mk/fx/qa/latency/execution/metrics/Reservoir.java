package com.mk.fx.qa.latency.execution.metrics;

import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

/**
 * Fixed-size sample of recorded values for approximate percentiles (Algorithm R). Exact while
 * fewer than {@code capacity} values have been recorded.
 */
public final class Reservoir {
  private final int capacity;
  private final long[] data;
  private final Random rnd;
  private long count;

  public Reservoir(int capacity) {
    this(capacity, new Random());
  }

  Reservoir(int capacity, Random rnd) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.capacity = capacity;
    this.data = new long[capacity];
    this.rnd = rnd;
  }

  public synchronized void add(long value) {
    count++;
    if (count <= capacity) {
      data[(int) count - 1] = value;
    } else {
      long j = rnd.nextLong(count);
      if (j < capacity) {
        data[(int) j] = value;
      }
    }
  }

  public synchronized long count() {
    return count;
  }

  /** Nearest-rank percentile of the sampled values; empty when nothing was recorded. */
  public synchronized Optional<Long> percentile(int p) {
    if (p < 0 || p > 100)
      throw new IllegalArgumentException("Percentile must be between 0 and 100");

    int size = (int) Math.min(count, capacity);
    if (size == 0) return Optional.empty();

    long[] copy = Arrays.copyOf(data, size);
    Arrays.sort(copy);
    int idx = Math.min(size - 1, Math.max(0, (int) Math.ceil((p / 100.0) * size) - 1));
    return Optional.of(copy[idx]);
  }
}

package com.mk.fx.qa.latency.execution.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class ReservoirTest {

  @Test
  void percentile_onSmallDataset_returnsExpectedQuantiles() {
    Reservoir r = new Reservoir(100);
    LongStream.rangeClosed(1, 100).forEach(r::add);
    assertEquals(95L, r.percentile(95).orElseThrow());
    assertEquals(99L, r.percentile(99).orElseThrow());
    assertEquals(100L, r.percentile(100).orElseThrow());
    assertEquals(1L, r.percentile(0).orElseThrow());
  }

  @Test
  void percentile_onEmpty_returnsEmpty() {
    Reservoir r = new Reservoir(10);
    assertTrue(r.percentile(95).isEmpty());
  }

  @Test
  void percentile_singleValue_isThatValueForEveryRank() {
    Reservoir r = new Reservoir(10);
    r.add(42L);
    assertEquals(42L, r.percentile(0).orElseThrow());
    assertEquals(42L, r.percentile(50).orElseThrow());
    assertEquals(42L, r.percentile(99).orElseThrow());
  }

  @Test
  void add_beyondCapacity_keepsCountingAndSamplesWithinRange() {
    Reservoir r = new Reservoir(50, new Random(7));
    LongStream.rangeClosed(1, 10_000).forEach(r::add);

    assertEquals(10_000L, r.count());
    long p95 = r.percentile(95).orElseThrow();
    assertTrue(p95 >= 1 && p95 <= 10_000);
    assertTrue(r.percentile(0).orElseThrow() <= p95);
  }

  @Test
  void percentile_outOfRange_rejected() {
    Reservoir r = new Reservoir(10);
    assertThrows(IllegalArgumentException.class, () -> r.percentile(-1));
    assertThrows(IllegalArgumentException.class, () -> r.percentile(101));
    assertThrows(IllegalArgumentException.class, () -> new Reservoir(0));
  }
}

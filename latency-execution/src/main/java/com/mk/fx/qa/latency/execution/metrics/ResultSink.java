package com.mk.fx.qa.latency.execution.metrics;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects outcomes from any number of worker threads. Outcomes are queued and applied by a single
 * consumer thread, which owns every {@link TargetAggregate} and the detail buffer, so no outcome is
 * lost or counted twice and aggregates need no locking.
 *
 * <p>When a {@link DetailSink} is configured, outcomes are buffered and handed over in batches of
 * {@code batchSize}; the buffer is replaced by a fresh one before the full batch is written, and
 * {@link #finish()} flushes the remainder.
 */
@Slf4j
public final class ResultSink implements Consumer<RequestOutcome> {

  private static final Message POISON = new Message(null);

  private final String runId;
  private final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();
  private final Map<String, TargetAggregate> aggregates = new LinkedHashMap<>();
  private final DetailSink detailSink;
  private final int batchSize;
  private final Thread consumer;
  private final AtomicBoolean finished = new AtomicBoolean(false);
  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong detailRowsWritten = new AtomicLong();
  private final AtomicLong detailWriteFailures = new AtomicLong();

  private List<RequestOutcome> buffer;
  private volatile List<TargetAggregate> result;

  /**
   * Creates and starts the sink.
   *
   * @param runId identifier used in the consumer thread name and logs
   * @param targetIds targets known up front; they get a row even without outcomes
   * @param detailSink receives detail batches, or null to skip the detailed trace
   * @param batchSize outcomes per detail batch
   */
  public ResultSink(String runId, List<String> targetIds, DetailSink detailSink, int batchSize) {
    this.runId = Objects.requireNonNull(runId, "runId");
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    this.detailSink = detailSink;
    this.batchSize = batchSize;
    this.buffer = new ArrayList<>(Math.min(batchSize, 1024));
    for (String targetId : Objects.requireNonNull(targetIds, "targetIds")) {
      aggregates.computeIfAbsent(targetId, TargetAggregate::new);
    }
    this.consumer = new Thread(this::consume, "result-sink-" + runId);
    this.consumer.setDaemon(true);
    this.consumer.start();
  }

  /** Queues an outcome; safe to call from any thread until {@link #finish()} is called. */
  @Override
  public void accept(RequestOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    if (finished.get()) {
      throw new IllegalStateException("Result sink for run " + runId + " is finished");
    }
    accepted.incrementAndGet();
    queue.add(new Message(outcome));
  }

  /**
   * Drains every queued outcome, flushes the last detail batch, freezes the aggregates and returns
   * them in target order. Subsequent calls return the same aggregates. Waiting is not interruptible;
   * a pending interrupt is preserved.
   */
  public List<TargetAggregate> finish() {
    if (finished.compareAndSet(false, true)) {
      queue.add(POISON);
      boolean interrupted = false;
      while (consumer.isAlive()) {
        try {
          consumer.join();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    return result;
  }

  public long acceptedCount() {
    return accepted.get();
  }

  public long detailRowsWritten() {
    return detailRowsWritten.get();
  }

  public long detailWriteFailures() {
    return detailWriteFailures.get();
  }

  private void consume() {
    try {
      while (true) {
        Message message = queue.take();
        if (message == POISON) {
          break;
        }
        apply(message.outcome());
      }
      // outcomes that raced with finish()
      Message late;
      while ((late = queue.poll()) != null) {
        apply(late.outcome());
      }
    } catch (InterruptedException e) {
      log.warn("Result sink {} interrupted; {} outcomes left unprocessed", runId, queue.size());
      Thread.currentThread().interrupt();
    } finally {
      flushDetail();
      closeDetailSink();
      aggregates.values().forEach(TargetAggregate::freeze);
      result = List.copyOf(aggregates.values());
    }
  }

  private void apply(RequestOutcome outcome) {
    aggregates.computeIfAbsent(outcome.targetId(), TargetAggregate::new).record(outcome);
    if (outcome.cleanupFailed()) {
      log.warn(
          "Connection for {}#{} not released cleanly: {}",
          outcome.targetId(),
          outcome.sequence(),
          outcome.cleanupError());
    }
    if (detailSink != null) {
      buffer.add(outcome);
      if (buffer.size() >= batchSize) {
        flushDetail();
      }
    }
  }

  private void flushDetail() {
    if (detailSink == null || buffer.isEmpty()) {
      return;
    }
    List<RequestOutcome> batch = buffer;
    buffer = new ArrayList<>(Math.min(batchSize, 1024));
    try {
      detailSink.writeBatch(batch);
      detailRowsWritten.addAndGet(batch.size());
    } catch (Exception e) {
      detailWriteFailures.incrementAndGet();
      log.warn(
          "Run {} failed to write {} detail rows: {}", runId, batch.size(), e.getMessage(), e);
    }
  }

  private void closeDetailSink() {
    if (detailSink == null) {
      return;
    }
    try {
      detailSink.close();
    } catch (Exception e) {
      log.warn("Run {} failed to close detail sink: {}", runId, e.getMessage(), e);
    }
  }

  private record Message(RequestOutcome outcome) {}
}

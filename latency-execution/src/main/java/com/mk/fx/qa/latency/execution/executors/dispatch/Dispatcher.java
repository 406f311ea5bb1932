package com.mk.fx.qa.latency.execution.executors.dispatch;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.latency.execution.model.RequestOutcome;
import com.mk.fx.qa.latency.execution.model.WorkItem;
import com.mk.fx.qa.latency.execution.validation.Classification;
import com.mk.fx.qa.latency.rest.TransportFailureKind;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Drains a work queue on a bounded pool. Every dispatched item yields exactly one outcome, at most
 * {@code concurrency} items are in flight and successive dispatches respect the configured minimum
 * intervals. The call returns only once nothing is in flight.
 */
@Slf4j
public final class Dispatcher {

  private Dispatcher() {
    throw new UnsupportedOperationException("Dispatcher cannot be instantiated");
  }

  /**
   * Executes the work items.
   *
   * <p>Cancellation, through {@code cancellationRequested} or an interrupt of the calling thread,
   * stops admission of new items. In-flight items still complete and reach {@code outcomeConsumer};
   * the remaining items are counted as skipped and produce no outcome. An interrupt is reported
   * through {@link DispatchResult#cancelled()} rather than rethrown so that callers can still flush
   * their results.
   *
   * @param runId identifier used in thread names and logs
   * @param parameters concurrency and rate settings
   * @param items work items in dispatch order
   * @param executor performs one item
   * @param outcomeConsumer receives every outcome, from worker threads
   * @param listener progress callbacks
   * @param cancellationRequested polled before each admission
   * @return dispatch counters
   */
  public static DispatchResult execute(
      String runId,
      DispatchParameters parameters,
      List<WorkItem> items,
      WorkItemExecutor executor,
      Consumer<RequestOutcome> outcomeConsumer,
      DispatchListener listener,
      BooleanSupplier cancellationRequested) {

    validate(runId, parameters, items, executor, outcomeConsumer, listener, cancellationRequested);

    int concurrency = parameters.concurrency();
    IntervalRateLimiter globalLimiter = IntervalRateLimiter.ofInterval(parameters.minInterval());
    Map<String, IntervalRateLimiter> targetLimiters = new HashMap<>();
    parameters
        .targetMinIntervals()
        .forEach((target, interval) -> targetLimiters.put(target, IntervalRateLimiter.ofInterval(interval)));

    Semaphore permits = new Semaphore(concurrency);
    AtomicLong completed = new AtomicLong();
    long dispatched = 0;
    boolean cancelled = false;

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("latency-dispatch-" + runId + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    ExecutorService pool = newFixedThreadPool(concurrency, threadFactory);

    long startNanos = System.nanoTime();
    try {
      for (WorkItem item : items) {
        if (shouldStop(cancellationRequested)) {
          cancelled = true;
          break;
        }
        // pace after the permit is held so each grant marks the actual dispatch instant
        permits.acquire();
        try {
          IntervalRateLimiter.acquireAll(
              globalLimiter,
              targetLimiters.getOrDefault(item.targetId(), IntervalRateLimiter.disabled()));
        } catch (InterruptedException interrupted) {
          permits.release();
          throw interrupted;
        }
        if (shouldStop(cancellationRequested)) {
          permits.release();
          cancelled = true;
          break;
        }
        dispatched++;
        listener.onDispatched(item);
        try {
          pool.execute(new ItemTask(item, executor, outcomeConsumer, listener, permits, completed));
        } catch (RejectedExecutionException rejected) {
          permits.release();
          throw rejected;
        }
      }
    } catch (InterruptedException interrupted) {
      log.info("Run {} dispatch interrupted after {} items", runId, dispatched);
      cancelled = true;
      for (Runnable pending : pool.shutdownNow()) {
        if (pending instanceof ItemTask task) {
          task.cancelBeforeStart();
        }
      }
    } finally {
      permits.acquireUninterruptibly(concurrency);
      permits.release(concurrency);
      pool.shutdown();
    }

    long elapsedNanos = System.nanoTime() - startNanos;
    long skipped = items.size() - dispatched;
    if (cancelled) {
      log.info(
          "Run {} dispatch cancelled: dispatched={} completed={} skipped={}",
          runId,
          dispatched,
          completed.get(),
          skipped);
    }
    return new DispatchResult(dispatched, completed.get(), skipped, cancelled, elapsedNanos);
  }

  /** One dispatched item; its permit is released exactly once, whether it runs or is drained. */
  private static final class ItemTask implements Runnable {

    private final WorkItem item;
    private final WorkItemExecutor executor;
    private final Consumer<RequestOutcome> outcomeConsumer;
    private final DispatchListener listener;
    private final Semaphore permits;
    private final AtomicLong completed;

    private ItemTask(
        WorkItem item,
        WorkItemExecutor executor,
        Consumer<RequestOutcome> outcomeConsumer,
        DispatchListener listener,
        Semaphore permits,
        AtomicLong completed) {
      this.item = item;
      this.executor = executor;
      this.outcomeConsumer = outcomeConsumer;
      this.listener = listener;
      this.permits = permits;
      this.completed = completed;
    }

    @Override
    public void run() {
      long startNanos = System.nanoTime();
      boolean interrupted = false;
      RequestOutcome outcome;
      try {
        outcome = Objects.requireNonNull(executor.execute(item), "executor returned no outcome");
      } catch (InterruptedException e) {
        interrupted = true;
        outcome = cancelledOutcome(startNanos);
      } catch (Throwable t) {
        log.error(
            "Work item {}#{} failed unexpectedly: {}",
            item.targetId(),
            item.sequence(),
            t.getMessage(),
            t);
        outcome =
            RequestOutcome.failed(item, startNanos, System.nanoTime(), Classification.internal(t));
      }
      record(outcome);
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    /** Called for items drained from the pool queue before a worker picked them up. */
    void cancelBeforeStart() {
      record(cancelledOutcome(System.nanoTime()));
    }

    private RequestOutcome cancelledOutcome(long startNanos) {
      return RequestOutcome.failed(
          item,
          startNanos,
          System.nanoTime(),
          Classification.transport(TransportFailureKind.CANCELLED, "Interrupted"));
    }

    private void record(RequestOutcome outcome) {
      try {
        outcomeConsumer.accept(outcome);
        listener.onCompleted(outcome);
      } catch (RuntimeException e) {
        log.error(
            "Outcome of work item {}#{} could not be recorded: {}",
            item.targetId(),
            item.sequence(),
            e.getMessage(),
            e);
      } finally {
        completed.incrementAndGet();
        permits.release();
      }
    }
  }

  private static void validate(
      String runId,
      DispatchParameters parameters,
      List<WorkItem> items,
      WorkItemExecutor executor,
      Consumer<RequestOutcome> outcomeConsumer,
      DispatchListener listener,
      BooleanSupplier cancellationRequested) {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(items, "items");
    Objects.requireNonNull(executor, "executor");
    Objects.requireNonNull(outcomeConsumer, "outcomeConsumer");
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
  }

  /** Consumes the interrupt flag; the interrupt is reported as a cancelled result instead. */
  private static boolean shouldStop(BooleanSupplier cancellationRequested) {
    return Thread.interrupted() || cancellationRequested.getAsBoolean();
  }
}

package io.meshdispatch.unit;

import io.meshdispatch.model.DeliveryUnit;
import io.meshdispatch.tx.TransactionManager;
import io.meshdispatch.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled staleness sweep that flips silent units to {@code offline}.
 *
 * <p>Runs {@link UnitStateTracker#sweepOffline} on a fixed delay. Each cycle is one
 * transaction; a failed cycle is logged and the next one runs as usual.
 */
public final class OfflineSweeper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OfflineSweeper.class.getName());

  private final TransactionManager txManager;
  private final UnitStateTracker tracker;
  private final Clock clock;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  public OfflineSweeper(TransactionManager txManager, UnitStateTracker tracker, Clock clock, long intervalMs) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.intervalMs = intervalMs;
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OfflineSweeper has been closed");
    }
    if (sweepTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mesh-dispatch-sweep-"));
    sweepTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single sweep. Called by the scheduler; may be invoked directly for testing.
   *
   * @return number of units marked offline
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      List<DeliveryUnit> marked = txManager.inTransaction(tx -> tracker.sweepOffline(tx, clock.instant()));
      if (!marked.isEmpty()) {
        logger.log(Level.INFO, "Marked {0} unit(s) offline", marked.size());
      }
      return marked.size();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Offline sweep failed", t);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}

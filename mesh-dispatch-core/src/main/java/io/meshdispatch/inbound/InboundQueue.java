package io.meshdispatch.inbound;

import io.meshdispatch.spi.FrameListener;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.util.DaemonThreadFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded FIFO between the radio reader and frame interpretation.
 *
 * <p>{@link #offer} never blocks. When the queue is full the oldest unprocessed frame is
 * discarded to make room, so the freshest telemetry always gets through. Exactly one
 * consumer thread drains the queue and hands frames to the {@link InboundFrameHandler}
 * in arrival order; handler failures are logged and the loop carries on.
 *
 * <p>Implements {@link FrameListener} so it can be registered with a transport directly.
 */
public final class InboundQueue implements FrameListener, AutoCloseable {
  private static final Logger logger = Logger.getLogger(InboundQueue.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final BlockingQueue<InboundFrame> queue;
  private final InboundFrameHandler handler;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long drainTimeoutMs;
  private final Object offerLock = new Object();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private ExecutorService consumer;

  private InboundQueue(Builder builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    if (builder.capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queue = new ArrayBlockingQueue<>(builder.capacity);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.drainTimeoutMs = builder.drainTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the consumer thread. Idempotent.
   */
  public synchronized void start() {
    if (!accepting.get()) {
      throw new IllegalStateException("InboundQueue has been closed");
    }
    if (consumer != null) {
      return;
    }
    running.set(true);
    consumer = Executors.newSingleThreadExecutor(new DaemonThreadFactory("mesh-dispatch-inbound-"));
    consumer.submit(this::consumerLoop);
  }

  @Override
  public void onFrame(byte[] frame) {
    offer(frame);
  }

  /**
   * Enqueues a frame, evicting the oldest one if the queue is full.
   *
   * @return {@code false} only if the queue has been closed
   */
  public boolean offer(byte[] payload) {
    if (!accepting.get()) {
      return false;
    }
    InboundFrame frame = new InboundFrame(payload, clock.instant());
    synchronized (offerLock) {
      while (!queue.offer(frame)) {
        InboundFrame dropped = queue.poll();
        if (dropped != null) {
          metrics.incrementInboundDropped();
          logger.log(Level.WARNING, "Inbound queue full; dropped frame received at {0}",
              dropped.receivedAt());
        }
      }
    }
    metrics.incrementInboundReceived();
    metrics.recordInboundDepth(queue.size());
    return true;
  }

  public int size() {
    return queue.size();
  }

  /**
   * Processes every frame currently queued on the calling thread. Intended for tests
   * that run without the consumer thread.
   *
   * @return number of frames processed
   */
  public int drain() {
    int processed = 0;
    InboundFrame frame;
    while ((frame = queue.poll()) != null) {
      process(frame);
      processed++;
    }
    return processed;
  }

  private void consumerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        InboundFrame frame = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (frame == null) {
          continue;
        }
        process(frame);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Inbound consumer loop error", t);
      }
    }
  }

  private void process(InboundFrame frame) {
    try {
      handler.handle(frame);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Inbound frame handler failed", e);
    } finally {
      metrics.recordInboundDepth(queue.size());
    }
  }

  /**
   * Stops accepting frames, lets the consumer drain what is queued within the drain
   * timeout, then stops it.
   */
  @Override
  public synchronized void close() {
    accepting.set(false);
    running.set(false);
    if (consumer == null) {
      return;
    }
    consumer.shutdown();
    try {
      if (!consumer.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; {0} inbound frame(s) discarded", queue.size());
        consumer.shutdownNow();
        consumer.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      consumer.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link InboundQueue}. */
  public static final class Builder {
    private InboundFrameHandler handler;
    private int capacity = 500;
    private MetricsExporter metrics;
    private Clock clock;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the single consumer of queued frames.
     *
     * <p><b>Required.</b>
     */
    public Builder handler(InboundFrameHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
     */
    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used to stamp receipt times.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public InboundQueue build() {
      return new InboundQueue(this);
    }
  }
}

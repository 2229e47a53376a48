package io.meshdispatch.outbound;

import io.meshdispatch.TransportException;
import io.meshdispatch.envelope.Envelope;
import io.meshdispatch.envelope.EnvelopeCodec;
import io.meshdispatch.model.PendingAck;
import io.meshdispatch.spi.MetricsExporter;
import io.meshdispatch.spi.PendingAckStore;
import io.meshdispatch.spi.Transport;
import io.meshdispatch.tx.TransactionManager;
import io.meshdispatch.tx.TransactionManager.Transaction;
import io.meshdispatch.util.DaemonThreadFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends commands that must be acknowledged by the receiving unit.
 *
 * <p>Every reliable message is backed by a durable {@link PendingAck} row, written in the
 * same transaction as the state change that produced it and transmitted only after that
 * transaction commits. A single scheduler thread polls due rows in deadline order
 * ({@link #tick()}); each due row is either re-sent verbatim (same {@code msg_id}) or, once
 * {@code maxAttempts} sends have gone unanswered, removed and reported to the
 * {@link AckExhaustionListener}.
 *
 * <p>ACK, exhaustion and cancellation all retire a row by deleting it under the store's
 * writer lock. Only the path whose delete removed the row acts on it.
 *
 * <p>Rows survive restarts. {@link #recover()} keeps their attempt counts and pulls
 * overdue deadlines forward to the current time.
 *
 * @see RetryPolicy
 */
public final class ReliableOutboundManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ReliableOutboundManager.class.getName());

  private final TransactionManager txManager;
  private final PendingAckStore pendingAckStore;
  private final Transport transport;
  private final EnvelopeCodec codec;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final long tickIntervalMs;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final Supplier<String> messageIds;

  private volatile AckExhaustionListener exhaustionListener;
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private ReliableOutboundManager(Builder builder) {
    this.txManager = Objects.requireNonNull(builder.txManager, "txManager");
    this.pendingAckStore = Objects.requireNonNull(builder.pendingAckStore, "pendingAckStore");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.tickIntervalMs <= 0) {
      throw new IllegalArgumentException("tickIntervalMs must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.tickIntervalMs = builder.tickIntervalMs;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.messageIds = builder.messageIds != null ? builder.messageIds : ReliableOutboundManager::newMessageId;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers the party that handles exhausted messages. Set once during wiring.
   */
  public void setExhaustionListener(AckExhaustionListener exhaustionListener) {
    this.exhaustionListener = Objects.requireNonNull(exhaustionListener, "exhaustionListener");
  }

  /**
   * Recovers persisted rows and starts the retry scheduler. Idempotent.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ReliableOutboundManager has been closed");
    }
    if (tickTask != null) {
      return;
    }
    recover();
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("mesh-dispatch-retry-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Persists a reliable message inside the caller's transaction and transmits it once
   * that transaction commits.
   *
   * @param tx         the active transaction
   * @param unitId     destination unit
   * @param envelope   the message; its {@code msg_id} is replaced with a fresh one
   * @param deliveryId correlated delivery, used for cancellation; may be {@code null}
   * @return the stored record
   */
  public PendingAck sendReliable(Transaction tx, String unitId, Envelope envelope, Long deliveryId) {
    Objects.requireNonNull(tx, "tx");
    Objects.requireNonNull(unitId, "unitId");
    Objects.requireNonNull(envelope, "envelope");
    String msgId = messageIds.get();
    String payload = codec.encode(envelope.withMsgId(msgId));
    Instant now = clock.instant();
    PendingAck pendingAck = new PendingAck(msgId, unitId, deliveryId, payload, now, now, 1,
        now.plusMillis(retryPolicy.computeDelayMs(1)));
    pendingAckStore.insert(tx.connection(), pendingAck);
    tx.afterCommit(() -> {
      metrics.incrementReliableSent();
      transmit(pendingAck.msgId(), pendingAck.payload());
    });
    return pendingAck;
  }

  /**
   * Same as {@link #sendReliable(Transaction, String, Envelope, Long)} in a transaction of its own.
   */
  public PendingAck sendReliable(String unitId, Envelope envelope, Long deliveryId) {
    return txManager.inTransaction(tx -> sendReliable(tx, unitId, envelope, deliveryId));
  }

  /**
   * Transmits a message without acknowledgment tracking once {@code tx} commits.
   */
  public void sendBestEffort(Transaction tx, Envelope envelope) {
    String payload = codec.encode(envelope);
    tx.afterCommit(() -> transmit(null, payload));
  }

  /**
   * Retires the record matching an ACK. Unknown or already-retired ids are ignored.
   *
   * @param msgId the {@code msg_id} echoed by the unit
   * @return the retired record, or empty for a duplicate or late ACK
   */
  public Optional<PendingAck> onAck(String msgId) {
    if (msgId == null) {
      metrics.incrementDuplicateAck();
      return Optional.empty();
    }
    Optional<PendingAck> retired = txManager.inTransaction(tx -> {
      Optional<PendingAck> existing = pendingAckStore.find(tx.connection(), msgId);
      if (existing.isEmpty() || pendingAckStore.delete(tx.connection(), msgId) == 0) {
        return Optional.<PendingAck>empty();
      }
      return existing;
    });
    if (retired.isPresent()) {
      metrics.incrementAckReceived();
      logger.log(Level.INFO, "ACK {0} from {1} after {2} attempt(s)",
          new Object[]{msgId, retired.get().unitId(), retired.get().attempts()});
    } else {
      metrics.incrementDuplicateAck();
      logger.log(Level.FINE, "Ignoring ACK for unknown msg_id {0}", msgId);
    }
    return retired;
  }

  /**
   * Retires every record correlated with a delivery without signalling exhaustion.
   *
   * @return number of records removed
   */
  public int cancelForDelivery(Transaction tx, long deliveryId) {
    int removed = 0;
    for (PendingAck pendingAck : pendingAckStore.findByDelivery(tx.connection(), deliveryId)) {
      removed += pendingAckStore.delete(tx.connection(), pendingAck.msgId());
    }
    if (removed > 0) {
      logger.log(Level.FINE, "Cancelled {0} pending message(s) for delivery {1}",
          new Object[]{removed, deliveryId});
    }
    return removed;
  }

  /**
   * Runs one retry cycle: processes up to {@code batchSize} due records, earliest deadline
   * first. Invoked by the scheduler; may be invoked directly with a controlled clock.
   *
   * @return number of records re-sent or exhausted
   */
  public int tick() {
    if (closed) {
      return 0;
    }
    int processed = 0;
    try {
      Instant now = clock.instant();
      List<PendingAck> due = txManager.read(conn -> pendingAckStore.findDue(conn, now, batchSize));
      for (PendingAck candidate : due) {
        try {
          if (processDue(candidate.msgId(), now)) {
            processed++;
          }
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to process pending message " + candidate.msgId(), e);
        }
      }
      metrics.recordPendingAcks(txManager.read(pendingAckStore::count));
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry cycle failed", t);
    }
    return processed;
  }

  /**
   * Reloads persisted records after a restart. Attempt counts are preserved; deadlines
   * already in the past become due immediately.
   *
   * @return the number of records awaiting acknowledgment
   */
  public int recover() {
    Instant now = clock.instant();
    List<PendingAck> rows = txManager.inTransaction(tx -> {
      pendingAckStore.rescheduleOverdue(tx.connection(), now);
      return pendingAckStore.findAll(tx.connection());
    });
    for (PendingAck row : rows) {
      logger.log(Level.INFO, "Recovered pending message {0} to {1} (attempts={2}, next={3})",
          new Object[]{row.msgId(), row.unitId(), row.attempts(), row.nextRetryAt()});
    }
    metrics.recordPendingAcks(rows.size());
    return rows.size();
  }

  /**
   * Returns all records awaiting acknowledgment, oldest first.
   */
  public List<PendingAck> pending() {
    return txManager.read(pendingAckStore::findAll);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private boolean processDue(String msgId, Instant now) {
    return txManager.inTransaction(tx -> {
      Optional<PendingAck> current = pendingAckStore.find(tx.connection(), msgId);
      if (current.isEmpty() || current.get().nextRetryAt().isAfter(now)) {
        // retired or rescheduled since the scan
        return false;
      }
      PendingAck pendingAck = current.get();
      if (pendingAck.attempts() >= maxAttempts) {
        if (pendingAckStore.delete(tx.connection(), msgId) == 0) {
          return false;
        }
        exhaust(tx, pendingAck);
        return true;
      }
      int nextAttempt = pendingAck.attempts() + 1;
      Instant nextRetryAt = now.plusMillis(retryPolicy.computeDelayMs(nextAttempt));
      if (pendingAckStore.markResent(tx.connection(), msgId, pendingAck.attempts(), now, nextRetryAt) == 0) {
        return false;
      }
      tx.afterCommit(() -> {
        metrics.incrementReliableRetried();
        logger.log(Level.INFO, "Re-sending {0} to {1} (attempt {2}/{3})",
            new Object[]{msgId, pendingAck.unitId(), nextAttempt, maxAttempts});
        transmit(msgId, pendingAck.payload());
      });
      return true;
    });
  }

  private void exhaust(Transaction tx, PendingAck pendingAck) {
    logger.log(Level.WARNING, "No ACK for {0} to {1} after {2} attempt(s); giving up",
        new Object[]{pendingAck.msgId(), pendingAck.unitId(), pendingAck.attempts()});
    AckExhaustionListener listener = exhaustionListener;
    if (listener != null) {
      listener.onExhausted(tx, pendingAck);
    } else {
      logger.warning("No exhaustion listener registered; dropping " + pendingAck.msgId());
    }
    tx.afterCommit(metrics::incrementAckExhausted);
  }

  private boolean transmit(String msgId, String payload) {
    try {
      transport.send(payload.getBytes(StandardCharsets.UTF_8));
      return true;
    } catch (TransportException e) {
      metrics.incrementSendFailures();
      logger.log(Level.WARNING, "Send failed" + (msgId == null ? "" : " for " + msgId)
          + "; " + (msgId == null ? "not retried" : "retry timer stays armed"), e);
      return false;
    }
  }

  static String newMessageId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  /**
   * Stops the retry scheduler. Pending records stay in the store for the next start.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
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

  /** Builder for {@link ReliableOutboundManager}. */
  public static final class Builder {
    private TransactionManager txManager;
    private PendingAckStore pendingAckStore;
    private Transport transport;
    private EnvelopeCodec codec;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private int batchSize = 50;
    private long tickIntervalMs = 1000;
    private Clock clock;
    private MetricsExporter metrics;
    private Supplier<String> messageIds;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder txManager(TransactionManager txManager) {
      this.txManager = txManager;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder pendingAckStore(PendingAckStore pendingAckStore) {
      this.pendingAckStore = pendingAckStore;
      return this;
    }

    /**
     * Sets the radio link used for every send.
     *
     * <p><b>Required.</b>
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder codec(EnvelopeCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Sets the wait between a send and the next attempt.
     *
     * <p><b>Required.</b>
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the total number of sends before a message is given up.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the maximum number of due records handled per tick.
     *
     * <p>Optional. Defaults to {@code 50}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the scheduler period.
     *
     * <p>Optional. Defaults to {@code 1000} ms.
     */
    public Builder tickIntervalMs(long tickIntervalMs) {
      this.tickIntervalMs = tickIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the source of message ids.
     *
     * <p>Optional. Defaults to 12 hex characters of a random UUID.
     */
    public Builder messageIds(Supplier<String> messageIds) {
      this.messageIds = messageIds;
      return this;
    }

    public ReliableOutboundManager build() {
      return new ReliableOutboundManager(this);
    }
  }
}

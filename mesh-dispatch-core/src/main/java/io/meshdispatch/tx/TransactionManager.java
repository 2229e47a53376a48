package io.meshdispatch.tx;

import io.meshdispatch.DispatchStoreException;
import io.meshdispatch.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of work against the durable store.
 *
 * <p>Write transactions are serialised by a single in-process writer lock, so a dispatcher
 * command, the inbound consumer, the retry scheduler and the offline sweeper never
 * interleave their read-modify-write cycles. Stores add row locks and status
 * compare-and-set on top for safety against other processes sharing the database.
 *
 * <p>A transaction started while another is active on the same thread joins it.
 * Callbacks registered with {@link Transaction#afterCommit(Runnable)} run after the
 * outermost commit, outside the writer lock; they are dropped on rollback.
 *
 * <pre>{@code
 * Delivery d = txManager.inTransaction(tx -> deliveryStore.insert(tx.connection(), address, null, now));
 * }</pre>
 */
public final class TransactionManager {
  private static final Logger logger = Logger.getLogger(TransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ReentrantLock writeLock = new ReentrantLock(true);
  private final ThreadLocal<Transaction> current = new ThreadLocal<>();

  public TransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Executes {@code work} in a write transaction and commits it.
   *
   * @return the value produced by {@code work}
   * @throws DispatchStoreException if a connection cannot be obtained or the commit fails
   */
  public <T> T inTransaction(TxWork<T> work) {
    Objects.requireNonNull(work, "work");
    Transaction joined = current.get();
    if (joined != null) {
      return applyJoined(joined, work);
    }

    List<Runnable> callbacks;
    T result;
    writeLock.lock();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      Transaction tx = new Transaction(conn);
      current.set(tx);
      try {
        result = work.apply(tx);
        conn.commit();
      } catch (SQLException | RuntimeException | Error e) {
        rollback(conn, e);
        throw e;
      } finally {
        current.remove();
        conn.setAutoCommit(true);
      }
      callbacks = tx.afterCommit;
    } catch (SQLException e) {
      throw new DispatchStoreException("Transaction failed", e);
    } finally {
      writeLock.unlock();
    }
    runAfterCommit(callbacks);
    return result;
  }

  /**
   * Executes read-only {@code work} on an auto-commit connection without taking the
   * writer lock. Joins the current transaction when called inside one.
   */
  public <T> T read(ReadWork<T> work) {
    Objects.requireNonNull(work, "work");
    Transaction joined = current.get();
    try {
      if (joined != null) {
        return work.apply(joined.connection());
      }
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        return work.apply(conn);
      }
    } catch (SQLException e) {
      throw new DispatchStoreException("Read failed", e);
    }
  }

  /**
   * {@code true} if the calling thread is inside {@link #inTransaction}.
   */
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  private static <T> T applyJoined(Transaction tx, TxWork<T> work) {
    try {
      return work.apply(tx);
    } catch (SQLException e) {
      throw new DispatchStoreException("Transaction failed", e);
    }
  }

  private static void rollback(Connection conn, Throwable failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void runAfterCommit(List<Runnable> callbacks) {
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "After-commit callback failed", e);
      }
    }
  }

  /** Unit of work executed inside a write transaction. */
  @FunctionalInterface
  public interface TxWork<T> {
    T apply(Transaction tx) throws SQLException;
  }

  /** Read-only unit of work. */
  @FunctionalInterface
  public interface ReadWork<T> {
    T apply(Connection conn) throws SQLException;
  }

  /**
   * Handle to the active transaction.
   */
  public static final class Transaction {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    /**
     * Registers an action to run once the outermost transaction has committed.
     */
    public void afterCommit(Runnable callback) {
      afterCommit.add(Objects.requireNonNull(callback, "callback"));
    }
  }
}

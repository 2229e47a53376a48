package io.meshdispatch.outbound;

import io.meshdispatch.model.PendingAck;
import io.meshdispatch.tx.TransactionManager.Transaction;

/**
 * Told when a reliable message ran out of attempts.
 *
 * <p>Invoked inside the transaction that removed the {@link PendingAck}, so the
 * consequences (failing the delivery, flagging the unit) commit atomically with the
 * removal. Throwing rolls both back; the record stays due and is retried on the next tick.
 */
@FunctionalInterface
public interface AckExhaustionListener {

  void onExhausted(Transaction tx, PendingAck pendingAck);
}

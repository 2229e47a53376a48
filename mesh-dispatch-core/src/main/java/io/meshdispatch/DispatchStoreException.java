package io.meshdispatch;

/**
 * Thrown when the durable store cannot complete an operation (connection failure,
 * SQL error, failed commit). The surrounding transaction has been rolled back.
 */
public class DispatchStoreException extends DispatchException {

  public DispatchStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

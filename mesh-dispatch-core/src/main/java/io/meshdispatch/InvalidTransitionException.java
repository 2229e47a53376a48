package io.meshdispatch;

/**
 * A requested state change is not allowed from the entity's current status.
 * Nothing was mutated.
 */
public class InvalidTransitionException extends DispatchException {

  public InvalidTransitionException(String message) {
    super(message);
  }
}

package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

import java.util.Objects;

/**
 * The first failing primitive operation of a write plan. The whole transaction has been rolled back;
 * {@link #getCause()} is the domain or storage error.
 */
public final class TransactionAbortedException extends RelationException {
  public TransactionAbortedException(DirectivePath path, Throwable cause) {
    super("Transaction rolled back: " + causeMessage(path, cause), path, cause);
  }

  // the path is appended once, by this exception
  private static String causeMessage(DirectivePath path, Throwable cause) {
    if (cause instanceof RelationException re && Objects.equals(re.path(), path)) return re.detail();
    return cause.getMessage();
  }
}

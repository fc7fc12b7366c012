package io.intellixity.relata.persistence.error;

import io.intellixity.relata.persistence.plan.DirectivePath;

/** Base of the relation engine's error taxonomy. Carries the directive path that produced it, when known. */
public class RelationException extends RuntimeException {
  private final String detail;
  private final DirectivePath path;

  public RelationException(String message, DirectivePath path) {
    super(path == null ? message : message + " (at " + path + ")");
    this.detail = message;
    this.path = path;
  }

  public RelationException(String message, DirectivePath path, Throwable cause) {
    super(path == null ? message : message + " (at " + path + ")", cause);
    this.detail = message;
    this.path = path;
  }

  /** Directive path of the failing operation; null for errors not tied to a write tree. */
  public DirectivePath path() {
    return path;
  }

  /** The message without its path suffix. */
  public String detail() {
    return detail;
  }
}

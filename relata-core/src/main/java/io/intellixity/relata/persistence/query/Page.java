package io.intellixity.relata.persistence.query;

public interface Page {
  int limit();
}

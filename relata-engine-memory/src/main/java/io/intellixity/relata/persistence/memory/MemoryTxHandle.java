package io.intellixity.relata.persistence.memory;

import io.intellixity.relata.persistence.exec.TxHandle;

import java.util.List;
import java.util.Map;

/**
 * Transaction of the in-memory executor: a private copy of every table taken at begin,
 * published on commit if no other transaction committed meanwhile.
 */
public record MemoryTxHandle(String id, long baseVersion, Map<String, List<Map<String, Object>>> tables) implements TxHandle {
}

package com.agentbridge.orchestrator.store;

import java.time.Instant;

/**
 * @param compacted true when the snapshot body was pruned by compaction; the
 *                  entry itself stays so version numbering remains gap-free
 */
public record HistoryEntry(int version, Instant timestamp, String sourceFormat, double fidelity, boolean compacted) {}

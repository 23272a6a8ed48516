package org.smileyface.riskcrawler.processor;

import java.time.Instant;

/**
 * Immutable snapshot of a processor's status.
 */
public final class ProcessorStatus {
    private final String id;
    private final ProcessorState state;
    private final long processedCount;
    private final long failedCount;
    private final String lastIdentifier;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public ProcessorStatus(String id, ProcessorState state, long processedCount, long failedCount,
                           String lastIdentifier, String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.state = state;
        this.processedCount = processedCount;
        this.failedCount = failedCount;
        this.lastIdentifier = lastIdentifier;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public ProcessorState getState() { return state; }
    /** Targets taken through a full cycle, whatever the outcome. */
    public long getProcessedCount() { return processedCount; }
    /** Cycles that ended in a transient, permanent or store failure. */
    public long getFailedCount() { return failedCount; }
    public String getLastIdentifier() { return lastIdentifier; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}

package org.smileyface.riskcrawler.processor;

/**
 * Lifecycle state of a TargetProcessor.
 */
public enum ProcessorState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}

package com.retail.storeintel.scheduler;

public enum JobOutcome {
    COMPLETED,
    FAILED,
    /**
     * The job was already running, so this trigger did nothing.
     */
    SKIPPED
}

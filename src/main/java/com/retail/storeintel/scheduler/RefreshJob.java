package com.retail.storeintel.scheduler;

import java.time.Duration;

/**
 * A recurring unit of work in the scheduler's job table. Implementations build
 * a complete result and publish it at the end, or publish nothing.
 */
public interface RefreshJob {

    String name();

    Duration cadence();

    /**
     * @throws Exception any failure; the scheduler logs it and marks the job idle again
     */
    void run(JobContext context) throws Exception;
}

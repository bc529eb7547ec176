package com.retail.storeintel.scheduler;

/**
 * Handed to a running job so it can stop between stores when the scheduler shuts down.
 */
public interface JobContext {

    boolean isStopRequested();

    JobContext NEVER_STOPPED = () -> false;
}

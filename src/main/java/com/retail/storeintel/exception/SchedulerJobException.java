package com.retail.storeintel.exception;

/**
 * Wraps an uncaught failure inside a scheduled job run so it can be logged
 * with job and store context. Never propagated out of the scheduler.
 */
public class SchedulerJobException extends RuntimeException {

    private final String jobName;
    private final String storeId;

    public SchedulerJobException(String jobName, String storeId, Throwable cause) {
        super(buildMessage(jobName, storeId, cause), cause);
        this.jobName = jobName;
        this.storeId = storeId;
    }

    public String getJobName() {
        return jobName;
    }

    public String getStoreId() {
        return storeId;
    }

    private static String buildMessage(String jobName, String storeId, Throwable cause) {
        String where = storeId != null ? " (store " + storeId + ")" : "";
        return "Job " + jobName + " failed" + where + ": " + (cause != null ? cause.getMessage() : "unknown");
    }
}

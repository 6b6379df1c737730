package com.codegraph.core.service.pipeline;

/**
 * Exception thrown when job submission or execution fails.
 */
public class PipelineException extends RuntimeException {

    public static final String PIPELINE_ERROR = "PIPELINE_ERROR";
    public static final String JOB_NOT_FOUND = "JOB_NOT_FOUND";
    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String JOB_CANCELLED = "JOB_CANCELLED";

    private final String jobId;
    private final String errorCode;

    public PipelineException(String message) {
        this(message, null, PIPELINE_ERROR, null);
    }

    public PipelineException(String message, Throwable cause) {
        this(message, null, PIPELINE_ERROR, cause);
    }

    public PipelineException(String message, String jobId, String errorCode) {
        this(message, jobId, errorCode, null);
    }

    public PipelineException(String message, String jobId, String errorCode, Throwable cause) {
        super(message, cause);
        this.jobId = jobId;
        this.errorCode = errorCode;
    }

    public static PipelineException jobNotFound(String jobId) {
        return new PipelineException("Job not found: " + jobId, jobId, JOB_NOT_FOUND);
    }

    public static PipelineException queueFull(String jobId, int utilizationPercent) {
        return new PipelineException("Job queue is full (" + utilizationPercent + "% utilized), please retry later",
                jobId, QUEUE_FULL);
    }

    public static PipelineException cancelled(String jobId) {
        return new PipelineException("Job cancelled: " + jobId, jobId, JOB_CANCELLED);
    }

    public String getJobId() {
        return jobId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

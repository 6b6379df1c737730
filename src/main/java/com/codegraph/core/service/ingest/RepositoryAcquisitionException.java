package com.codegraph.core.service.ingest;

/**
 * Exception thrown when a repository cannot be cloned or checked out.
 */
public class RepositoryAcquisitionException extends RuntimeException {

    public static final String ACQUISITION_FAILED = "REPOSITORY_ACQUISITION_FAILED";

    private final String repoUrl;
    private final String errorCode;

    public RepositoryAcquisitionException(String message, String repoUrl, Throwable cause) {
        super(message, cause);
        this.repoUrl = repoUrl;
        this.errorCode = ACQUISITION_FAILED;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public String getErrorCode() {
        return errorCode;
    }
}

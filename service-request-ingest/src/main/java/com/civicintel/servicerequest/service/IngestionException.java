package com.civicintel.servicerequest.service;

/**
 * An ingestion run was aborted. Pages committed before the failure stay in the store.
 */
public class IngestionException extends RuntimeException {

    private final String runId;

    public IngestionException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}

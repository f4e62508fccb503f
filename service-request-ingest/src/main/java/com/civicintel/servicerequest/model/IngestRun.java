package com.civicintel.servicerequest.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Tracks each ingestion run for observability.
 * Stored in the ingest_runs table alongside the data it loaded.
 */
@Data
@Builder
public class IngestRun {

    private String runId;           // UUID
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Status status;
    private long estimatedTotal;    // 0 when the count call failed
    private long recordsFetched;
    private long recordsUpserted;
    private long recordsSkipped;
    private int pages;
    private String errorMessage;    // null on success

    public enum Status {
        RUNNING, SUCCESS, FAILED
    }

    public boolean hasKnownTotal() {
        return estimatedTotal > 0;
    }

    public void recordPage(int fetched, int upserted, int skipped) {
        pages++;
        recordsFetched += fetched;
        recordsUpserted += upserted;
        recordsSkipped += skipped;
    }
}

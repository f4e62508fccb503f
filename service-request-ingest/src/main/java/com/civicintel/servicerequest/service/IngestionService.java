package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.config.IngestProperties;
import com.civicintel.servicerequest.model.DateWindow;
import com.civicintel.servicerequest.model.IngestRun;
import com.civicintel.servicerequest.model.ServiceRequest;
import com.civicintel.servicerequest.model.SocrataServiceRequest;
import com.civicintel.servicerequest.output.ServiceRequestStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates one ingestion run over a creation-date window.
 *
 *  1. resolve the window, ensure the schema, clear dimension caches
 *  2. best-effort count of matching records (0 = unknown)
 *  3. page through the API ordered by created_date; each page is written in
 *     its own transaction, so a page lands completely or not at all
 *  4. stop on an empty page, or once the known total has been fetched
 *
 * A fetch that still fails after retries, or a page that cannot be written,
 * fails the run with {@link IngestionException}. Pages committed before that
 * point stay in the store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final SocrataApiClient apiClient;
    private final ServiceRequestMapper mapper;
    private final DimensionResolver dimensionResolver;
    private final ServiceRequestStore store;
    private final TransactionTemplate transactionTemplate;
    private final IngestProperties properties;
    private final Clock clock;
    private final IngestProgressListener progressListener;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile IngestRun lastRun;

    /** Run over the configured window. */
    public IngestRun run() {
        return run(DateWindow.resolve(properties.window(), clock));
    }

    public IngestRun run(DateWindow window) {
        if (!running.compareAndSet(false, true)) {
            throw new IngestionAlreadyRunningException("An ingestion run is already in progress");
        }
        try {
            return execute(window);
        } finally {
            running.set(false);
        }
    }

    /**
     * Claim the run slot and execute on a background thread.
     *
     * @return false, without starting anything, when a run is already in progress
     */
    public boolean startInBackground(DateWindow window) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        Thread worker = new Thread(() -> {
            try {
                execute(window);
            } catch (IngestionException e) {
                log.error("Background ingestion {} to {} failed: {}", window.start(), window.end(), e.getMessage());
            } finally {
                running.set(false);
            }
        }, "manual-ingest");
        try {
            worker.start();
        } catch (RuntimeException | Error e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** The run in progress, or the most recent one since startup. */
    public Optional<IngestRun> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private IngestRun execute(DateWindow window) {
        IngestRun run = IngestRun.builder()
                .runId(UUID.randomUUID().toString())
                .windowStart(window.start())
                .windowEnd(window.end())
                .startedAt(LocalDateTime.now(clock))
                .status(IngestRun.Status.RUNNING)
                .build();
        lastRun = run;

        log.info("Ingesting NYC 311 service requests from {} to {} (page size {})",
                window.start(), window.end(), properties.pageSize());

        try {
            store.ensureSchema();
            dimensionResolver.reset();

            run.setEstimatedTotal(estimateTotal(window));
            fetchPages(window, run);

            run.setStatus(IngestRun.Status.SUCCESS);
            log.info("Ingestion completed. Total records processed: {} ({} upserted, {} skipped, {} new dimension rows)",
                    run.getRecordsFetched(), run.getRecordsUpserted(), run.getRecordsSkipped(),
                    dimensionResolver.rowsCreated());
            return run;

        } catch (RuntimeException e) {
            // a rolled-back page may have taken freshly cached dimension rows with it
            dimensionResolver.reset();
            run.setStatus(IngestRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
            log.error("Ingestion run {} failed after {} records: {}",
                    run.getRunId(), run.getRecordsFetched(), e.getMessage(), e);
            throw new IngestionException(run.getRunId(), "Ingestion run " + run.getRunId() + " failed", e);

        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            store.writeIngestRun(run);
        }
    }

    private long estimateTotal(DateWindow window) {
        try {
            long total = apiClient.fetchCount(window.whereClause());
            log.info("Estimated {} records to fetch", total);
            return total;
        } catch (RuntimeException e) {
            log.warn("Could not get count estimate, progress will be reported as raw counts: {}", e.getMessage());
            return 0;
        }
    }

    private void fetchPages(DateWindow window, IngestRun run) {
        int pageSize = properties.pageSize();
        long offset = 0;

        while (true) {
            List<SocrataServiceRequest> page = apiClient.fetchPage(pageQuery(window, pageSize, offset));
            if (page.isEmpty()) {
                log.debug("Empty page at offset {}, end of data", offset);
                break;
            }

            PageResult result = transactionTemplate.execute(status -> writePage(page));
            run.recordPage(page.size(), result.upserted(), result.skipped());
            offset += pageSize;

            progressListener.onPage(run);

            if (run.hasKnownTotal() && run.getRecordsFetched() >= run.getEstimatedTotal()) {
                break;
            }
        }
    }

    private PageResult writePage(List<SocrataServiceRequest> page) {
        int upserted = 0;
        int skipped = 0;
        for (SocrataServiceRequest raw : page) {
            Optional<ServiceRequest> mapped = mapper.map(raw);
            if (mapped.isEmpty()) {
                skipped++;
                continue;
            }
            ServiceRequest request = mapped.get();
            store.upsert(request, dimensionResolver.resolveAll(request));
            upserted++;
        }
        if (skipped > 0) {
            log.debug("Page written: {} upserted, {} skipped", upserted, skipped);
        }
        return new PageResult(upserted, skipped);
    }

    private Map<String, String> pageQuery(DateWindow window, int pageSize, long offset) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$limit", String.valueOf(pageSize));
        params.put("$offset", String.valueOf(offset));
        params.put("$order", "created_date");
        params.put("$where", window.whereClause());
        return params;
    }

    private record PageResult(int upserted, int skipped) {}
}

package com.civicintel.servicerequest.output;

import com.civicintel.servicerequest.model.Dimension;
import com.civicintel.servicerequest.model.IngestRun;
import com.civicintel.servicerequest.model.ServiceRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite star schema: service_requests fact table plus four dimension tables,
 * and ingest_runs for run history.
 *
 * Downstream reporting reads these tables with plain SQL; nothing here is
 * ever deleted by the pipeline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ServiceRequestStore {

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS agency (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL UNIQUE
            )""",
            """
            CREATE TABLE IF NOT EXISTS complaint_type (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL UNIQUE
            )""",
            """
            CREATE TABLE IF NOT EXISTS descriptor (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL UNIQUE
            )""",
            """
            CREATE TABLE IF NOT EXISTS borough (
              id INTEGER PRIMARY KEY,
              name TEXT NOT NULL UNIQUE
            )""",
            """
            CREATE TABLE IF NOT EXISTS service_requests (
              unique_key INTEGER PRIMARY KEY,
              created_date TEXT NOT NULL,
              closed_date TEXT,
              resolution_description TEXT,
              incident_zip TEXT,
              latitude REAL,
              longitude REAL,
              agency_id INTEGER,
              complaint_type_id INTEGER,
              descriptor_id INTEGER,
              borough_id INTEGER,
              CONSTRAINT fk_agency FOREIGN KEY (agency_id) REFERENCES agency(id),
              CONSTRAINT fk_complaint_type FOREIGN KEY (complaint_type_id) REFERENCES complaint_type(id),
              CONSTRAINT fk_descriptor FOREIGN KEY (descriptor_id) REFERENCES descriptor(id),
              CONSTRAINT fk_borough FOREIGN KEY (borough_id) REFERENCES borough(id)
            )""",
            "CREATE INDEX IF NOT EXISTS idx_sr_created_date ON service_requests(created_date)",
            "CREATE INDEX IF NOT EXISTS idx_sr_closed_date ON service_requests(closed_date)",
            "CREATE INDEX IF NOT EXISTS idx_sr_complaint_type ON service_requests(complaint_type_id)",
            "CREATE INDEX IF NOT EXISTS idx_sr_borough ON service_requests(borough_id)",
            """
            CREATE TABLE IF NOT EXISTS ingest_runs (
              run_id TEXT PRIMARY KEY,
              window_start TEXT NOT NULL,
              window_end TEXT NOT NULL,
              started_at TEXT NOT NULL,
              completed_at TEXT,
              status TEXT NOT NULL,
              estimated_total INTEGER NOT NULL DEFAULT 0,
              records_fetched INTEGER NOT NULL DEFAULT 0,
              records_upserted INTEGER NOT NULL DEFAULT 0,
              records_skipped INTEGER NOT NULL DEFAULT 0,
              pages INTEGER NOT NULL DEFAULT 0,
              error_message TEXT
            )""");

    private static final String UPSERT_SQL = """
            INSERT INTO service_requests (
                unique_key, created_date, closed_date, resolution_description, incident_zip,
                latitude, longitude, agency_id, complaint_type_id, descriptor_id, borough_id
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(unique_key) DO UPDATE SET
                created_date = excluded.created_date,
                closed_date = excluded.closed_date,
                resolution_description = excluded.resolution_description,
                incident_zip = excluded.incident_zip,
                latitude = excluded.latitude,
                longitude = excluded.longitude,
                agency_id = excluded.agency_id,
                complaint_type_id = excluded.complaint_type_id,
                descriptor_id = excluded.descriptor_id,
                borough_id = excluded.borough_id
            """;

    private static final RowMapper<IngestRun> RUN_MAPPER = (rs, rowNum) -> IngestRun.builder()
            .runId(rs.getString("run_id"))
            .windowStart(LocalDate.parse(rs.getString("window_start")))
            .windowEnd(LocalDate.parse(rs.getString("window_end")))
            .startedAt(LocalDateTime.parse(rs.getString("started_at")))
            .completedAt(rs.getString("completed_at") != null ? LocalDateTime.parse(rs.getString("completed_at")) : null)
            .status(IngestRun.Status.valueOf(rs.getString("status")))
            .estimatedTotal(rs.getLong("estimated_total"))
            .recordsFetched(rs.getLong("records_fetched"))
            .recordsUpserted(rs.getLong("records_upserted"))
            .recordsSkipped(rs.getLong("records_skipped"))
            .pages(rs.getInt("pages"))
            .errorMessage(rs.getString("error_message"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    /** Create-if-absent; never drops or alters existing tables. */
    public void ensureSchema() {
        log.info("Ensuring SQLite schema exists...");
        SCHEMA.forEach(jdbcTemplate::execute);
        log.info("SQLite schema ready.");
    }

    /**
     * Insert the request, or overwrite every mutable column if its unique_key is already stored.
     *
     * @param dimensionIds resolved surrogate ids; missing or null entries become NULL foreign keys
     */
    public void upsert(ServiceRequest request, Map<Dimension, Long> dimensionIds) {
        jdbcTemplate.update(UPSERT_SQL,
                request.getUniqueKey(),
                request.getCreatedDate(),
                request.getClosedDate(),
                request.getResolutionDescription(),
                request.getIncidentZip(),
                request.getLatitude(),
                request.getLongitude(),
                dimensionIds.get(Dimension.AGENCY),
                dimensionIds.get(Dimension.COMPLAINT_TYPE),
                dimensionIds.get(Dimension.DESCRIPTOR),
                dimensionIds.get(Dimension.BOROUGH));
    }

    /** Best effort: run metadata must never mask the outcome of the run itself. */
    public void writeIngestRun(IngestRun run) {
        try {
            jdbcTemplate.update("""
                    INSERT OR REPLACE INTO ingest_runs
                    (run_id, window_start, window_end, started_at, completed_at, status,
                     estimated_total, records_fetched, records_upserted, records_skipped, pages, error_message)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    run.getRunId(),
                    run.getWindowStart().toString(),
                    run.getWindowEnd().toString(),
                    run.getStartedAt().toString(),
                    run.getCompletedAt() != null ? run.getCompletedAt().toString() : null,
                    run.getStatus().name(),
                    run.getEstimatedTotal(),
                    run.getRecordsFetched(),
                    run.getRecordsUpserted(),
                    run.getRecordsSkipped(),
                    run.getPages(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write ingest run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    public Optional<IngestRun> findLatestRun() {
        return jdbcTemplate.query(
                        "SELECT * FROM ingest_runs ORDER BY started_at DESC LIMIT 1", RUN_MAPPER)
                .stream()
                .findFirst();
    }
}

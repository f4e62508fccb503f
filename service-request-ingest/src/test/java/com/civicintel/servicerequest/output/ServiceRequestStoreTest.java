package com.civicintel.servicerequest.output;

import com.civicintel.servicerequest.config.StoreConfig;
import com.civicintel.servicerequest.model.Dimension;
import com.civicintel.servicerequest.model.IngestRun;
import com.civicintel.servicerequest.model.ServiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRequestStoreTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate;
    private ServiceRequestStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(StoreConfig.sqliteDataSource(tempDir.resolve("store.sqlite")));
        store = new ServiceRequestStore(jdbcTemplate);
        store.ensureSchema();
    }

    private static ServiceRequest request(long key, String closedDate, Double latitude) {
        return ServiceRequest.builder()
                .uniqueKey(key)
                .createdDate("2024-01-07T08:00:00+00:00")
                .closedDate(closedDate)
                .resolutionDescription("Pending")
                .incidentZip("10001")
                .latitude(latitude)
                .longitude(-73.99)
                .build();
    }

    private static Map<Dimension, Long> noDimensions() {
        return new EnumMap<>(Dimension.class);
    }

    @Test
    @DisplayName("ensureSchema is idempotent and creates every table")
    void schemaCreatedOnce() {
        store.ensureSchema();

        List<String> tables = jdbcTemplate.queryForList(
                "SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name", String.class);
        assertThat(tables).contains(
                "agency", "borough", "complaint_type", "descriptor", "ingest_runs", "service_requests");
    }

    @Test
    @DisplayName("re-upserting a key overwrites it: one row, latest values")
    void upsertOverwrites() {
        store.upsert(request(100L, null, 40.70), noDimensions());
        store.upsert(request(100L, "2024-01-08T09:30:00+00:00", null), noDimensions());

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM service_requests", Long.class)).isEqualTo(1);
        Map<String, Object> row = jdbcTemplate.queryForMap("SELECT * FROM service_requests WHERE unique_key = 100");
        assertThat(row.get("closed_date")).isEqualTo("2024-01-08T09:30:00+00:00");
        assertThat(row.get("latitude")).isNull();
    }

    @Test
    void upsertWritesDimensionReferences() {
        jdbcTemplate.update("INSERT INTO agency(id, name) VALUES (3, 'DOT')");
        Map<Dimension, Long> ids = noDimensions();
        ids.put(Dimension.AGENCY, 3L);

        store.upsert(request(7L, null, null), ids);

        assertThat(jdbcTemplate.queryForObject(
                "SELECT agency_id FROM service_requests WHERE unique_key = 7", Long.class)).isEqualTo(3L);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT borough_id FROM service_requests WHERE unique_key = 7", Long.class)).isNull();
    }

    @Test
    @DisplayName("foreign keys are enforced on every connection")
    void danglingReferenceRejected() {
        Map<Dimension, Long> ids = noDimensions();
        ids.put(Dimension.BOROUGH, 999L);

        assertThatThrownBy(() -> store.upsert(request(8L, null, null), ids))
                .isInstanceOf(DataAccessException.class)
                .hasMessageContaining("FOREIGN KEY");
    }

    @Test
    void ingestRunRoundTrip() {
        IngestRun run = IngestRun.builder()
                .runId("run-1")
                .windowStart(LocalDate.of(2024, 1, 7))
                .windowEnd(LocalDate.of(2024, 1, 10))
                .startedAt(LocalDateTime.of(2024, 1, 11, 3, 0))
                .status(IngestRun.Status.RUNNING)
                .build();
        store.writeIngestRun(run);

        run.setStatus(IngestRun.Status.FAILED);
        run.setCompletedAt(LocalDateTime.of(2024, 1, 11, 3, 5));
        run.recordPage(1000, 998, 2);
        run.setErrorMessage("HTTP 503: Service Unavailable");
        store.writeIngestRun(run);

        IngestRun stored = store.findLatestRun().orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(IngestRun.Status.FAILED);
        assertThat(stored.getRecordsUpserted()).isEqualTo(998);
        assertThat(stored.getRecordsSkipped()).isEqualTo(2);
        assertThat(stored.getPages()).isEqualTo(1);
        assertThat(stored.getErrorMessage()).isEqualTo("HTTP 503: Service Unavailable");
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ingest_runs", Long.class)).isEqualTo(1);
    }

    @Test
    void findLatestRunEmptyWhenNoRuns() {
        assertThat(store.findLatestRun()).isEmpty();
    }
}

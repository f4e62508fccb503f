package com.civicintel.servicerequest.config;

import com.civicintel.servicerequest.model.DateWindow;
import com.civicintel.servicerequest.output.ServiceRequestStore;
import com.civicintel.servicerequest.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class IngestController {

    private final IngestionService ingestionService;
    private final ServiceRequestStore store;
    private final IngestProperties properties;
    private final Clock clock;

    /**
     * Start an ingestion run in the background.
     *
     * POST /ingest/trigger?start=2024-01-07&end=2024-01-10
     *
     * Either date may be omitted and falls back to the configured window.
     */
    @PostMapping("/ingest/trigger")
    public ResponseEntity<Map<String, String>> trigger(
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        DateWindow window;
        try {
            IngestProperties.Window configured = properties.window();
            window = DateWindow.resolve(
                    start != null ? start : configured.startDate(),
                    end != null ? end : configured.endDate(),
                    configured.defaultDays(),
                    clock);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (!ingestionService.startInBackground(window)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "An ingestion run is already in progress"));
        }

        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "start", window.start().toString(),
                "end", window.end().toString()));
    }

    @GetMapping("/ingest/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "service-request-ingest");
        body.put("version", "1.0.0");
        body.put("dataSource", properties.api().baseUrl());
        body.put("running", ingestionService.isRunning());
        body.put("lastRun", ingestionService.getLastRun()
                .or(store::findLatestRun)
                .orElse(null));
        return ResponseEntity.ok(body);
    }
}

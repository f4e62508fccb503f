package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.model.IngestRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingProgressListener implements IngestProgressListener {

    @Override
    public void onPage(IngestRun run) {
        if (run.hasKnownTotal()) {
            double percent = run.getRecordsFetched() * 100.0 / run.getEstimatedTotal();
            log.info("Progress {}/{} ({}%)", run.getRecordsFetched(), run.getEstimatedTotal(),
                    String.format("%.1f", percent));
        } else {
            log.info("Fetched {} records so far...", run.getRecordsFetched());
        }
    }
}

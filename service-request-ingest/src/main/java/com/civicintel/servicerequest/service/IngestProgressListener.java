package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.model.IngestRun;

/**
 * Notified after every committed page.
 */
@FunctionalInterface
public interface IngestProgressListener {

    void onPage(IngestRun run);
}

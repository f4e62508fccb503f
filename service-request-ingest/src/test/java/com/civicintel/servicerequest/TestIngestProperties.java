package com.civicintel.servicerequest;

import com.civicintel.servicerequest.config.IngestProperties;

import java.time.Duration;

/**
 * Builds {@link IngestProperties} for tests without a Spring context.
 */
public final class TestIngestProperties {

    public static final String BASE_URL = "https://data.example.test/resource/erm2-nwe9.json";

    private TestIngestProperties() {
    }

    public static IngestProperties create(String baseUrl, String startDate, String endDate, int pageSize,
                                          Duration retryBaseDelay, String appToken) {
        return new IngestProperties(
                new IngestProperties.Api(
                        baseUrl,
                        appToken,
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(5),
                        new IngestProperties.RetrySettings(5, retryBaseDelay, 2.0, retryBaseDelay.multipliedBy(16))),
                new IngestProperties.Window(startDate, endDate, 7),
                pageSize,
                new IngestProperties.Store("unused.sqlite"),
                new IngestProperties.CacheSettings(10_000),
                new IngestProperties.Scheduling("0 0 3 * * ?", false));
    }

    public static IngestProperties withRetryDelay(Duration retryBaseDelay) {
        return create(BASE_URL, "2024-01-07", "2024-01-10", 1000, retryBaseDelay, null);
    }

    public static IngestProperties defaults() {
        return withRetryDelay(Duration.ofMillis(1));
    }
}

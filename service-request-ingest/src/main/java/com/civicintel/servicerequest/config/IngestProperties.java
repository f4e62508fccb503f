package com.civicintel.servicerequest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable ingestion settings, bound once at startup and handed to collaborators
 * through their constructors.
 *
 * Values come from application.yml, whose placeholders read the environment first:
 *   START_DATE, END_DATE, PAGE_SIZE, SOCRATA_APP_TOKEN, SOCRATA_URL, DB_PATH.
 * An environment variable always wins over the yml default.
 */
@ConfigurationProperties(prefix = "service-request-ingest")
public record IngestProperties(
        @DefaultValue Api api,
        @DefaultValue Window window,
        @DefaultValue("5000") int pageSize,
        @DefaultValue Store store,
        @DefaultValue CacheSettings dimensionCache,
        @DefaultValue Scheduling scheduling) {

    public static final String DEFAULT_BASE_URL = "https://data.cityofnewyork.us/resource/erm2-nwe9.json";

    public IngestProperties {
        if (pageSize < 1) {
            throw new IllegalArgumentException("page-size must be positive, was " + pageSize);
        }
    }

    public record Api(
            @DefaultValue(DEFAULT_BASE_URL) String baseUrl,
            String appToken,
            @DefaultValue("10s") Duration connectTimeout,
            @DefaultValue("60s") Duration readTimeout,
            @DefaultValue RetrySettings retry) {

        public boolean hasAppToken() {
            return appToken != null && !appToken.isBlank();
        }
    }

    /** Backoff for transient fetch failures: baseDelay, baseDelay * multiplier, ... capped at maxDelay. */
    public record RetrySettings(
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("1s") Duration baseDelay,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("16s") Duration maxDelay) {
    }

    /**
     * Blank start/end fall back to: end = today (UTC), start = end - defaultDays.
     * Accepts ISO dates or ISO date-times (only the date part is used).
     */
    public record Window(
            String startDate,
            String endDate,
            @DefaultValue("7") int defaultDays) {
    }

    public record Store(@DefaultValue("nyc311.sqlite") String path) {
    }

    public record CacheSettings(@DefaultValue("10000") int maxEntries) {
    }

    public record Scheduling(
            @DefaultValue("0 0 3 * * ?") String cron,
            boolean runOnStartup) {
    }
}

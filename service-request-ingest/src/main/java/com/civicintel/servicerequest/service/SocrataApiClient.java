package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.config.IngestProperties;
import com.civicintel.servicerequest.model.SocrataServiceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the Socrata SODA endpoint for NYC 311 service requests.
 *
 * Every call is a fresh GET. Failures that look transient (non-2xx, I/O, unparseable
 * body) are raised as {@link TransientFetchException} and retried with exponential
 * backoff by the {@link RetryPolicy}; the last failure is rethrown to the caller.
 *
 * Sending an app token (SOCRATA_APP_TOKEN) lifts Socrata's anonymous throttling.
 */
@Service
@Slf4j
public class SocrataApiClient {

    static final String APP_TOKEN_HEADER = "X-App-Token";
    private static final int ERROR_BODY_LIMIT = 200;

    private final RestTemplate restTemplate;
    private final IngestProperties.Api api;
    private final Retry retry;

    public SocrataApiClient(RestTemplate restTemplate, IngestProperties properties) {
        this.restTemplate = restTemplate;
        this.api = properties.api();
        this.retry = RetryPolicy.from(api.retry()).toRetry("socrata");
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Socrata call failed (attempt {}), retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable().getMessage()));
    }

    /**
     * Fetch one page of raw records.
     *
     * @param queryParams SoQL parameters, e.g. $limit, $offset, $order, $where
     * @return records in API order, empty when the API has nothing more
     */
    public List<SocrataServiceRequest> fetchPage(Map<String, String> queryParams) {
        URI uri = buildUri(queryParams);
        SocrataServiceRequest[] page = retry.executeSupplier(() -> get(uri, SocrataServiceRequest[].class));
        return Arrays.asList(page);
    }

    /**
     * Ask the API how many records match {@code whereClause}.
     * Socrata answers {@code [{"count_1":"1234"}]}; anything else counts as 0.
     */
    public long fetchCount(String whereClause) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$select", "count(1)");
        params.put("$where", whereClause);

        JsonNode[] rows = retry.executeSupplier(() -> get(buildUri(params), JsonNode[].class));
        if (rows.length == 0 || rows[0] == null || !rows[0].hasNonNull("count_1")) {
            return 0;
        }
        return rows[0].get("count_1").asLong(0);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private URI buildUri(Map<String, String> queryParams) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(api.baseUrl());
        queryParams.forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    private <T> T get(URI uri, Class<T> responseType) {
        log.debug("Calling Socrata API: {}", uri);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (api.hasAppToken()) {
            headers.set(APP_TOKEN_HEADER, api.appToken());
        }

        T body;
        try {
            body = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), responseType).getBody();
        } catch (RestClientResponseException e) {
            throw new TransientFetchException(
                    "HTTP " + e.getStatusCode().value() + ": " + abbreviate(e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            throw new TransientFetchException("Socrata request failed: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new TransientFetchException("Empty response body from " + uri);
        }
        return body;
    }

    private String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT);
    }
}

package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.model.ServiceRequest;
import com.civicintel.servicerequest.model.SocrataServiceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps raw Socrata rows to the normalised ServiceRequest domain model.
 *
 * Field-level coercion never throws:
 *  - a missing or non-numeric unique_key drops the whole record (nothing to upsert on)
 *  - a missing created_date drops the record (the fact table requires it)
 *  - a non-numeric latitude/longitude becomes null, the rest of the record is kept
 *  - numbers and numeric strings are both accepted; objects and arrays are unusable
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ServiceRequestMapper {

    private final DateNormalizer dateNormalizer;

    public Optional<ServiceRequest> map(SocrataServiceRequest raw) {
        Long uniqueKey = parseKey(raw.getUniqueKey());
        if (uniqueKey == null) {
            log.debug("Skipping record with unusable unique_key: {}", raw.getUniqueKey());
            return Optional.empty();
        }

        String createdDate = dateNormalizer.normalize(raw.getCreatedDate());
        if (createdDate == null) {
            log.debug("Skipping record {} with no created_date", uniqueKey);
            return Optional.empty();
        }

        return Optional.of(ServiceRequest.builder()
                .uniqueKey(uniqueKey)
                .createdDate(createdDate)
                .closedDate(dateNormalizer.normalize(raw.getClosedDate()))
                .resolutionDescription(emptyToNull(raw.getResolutionDescription()))
                .incidentZip(emptyToNull(raw.getIncidentZip()))
                .latitude(parseCoordinate(raw.getLatitude(), uniqueKey))
                .longitude(parseCoordinate(raw.getLongitude(), uniqueKey))
                .agency(raw.getAgency())
                .complaintType(raw.getComplaintType())
                .descriptor(raw.getDescriptor())
                .borough(raw.getBorough())
                .build());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Long parseKey(JsonNode val) {
        if (val == null || val.isNull()) return null;
        if (val.isIntegralNumber()) {
            return val.canConvertToLong() ? val.longValue() : null;
        }
        if (!val.isTextual() || val.textValue().isBlank()) return null;
        try {
            return Long.parseLong(val.textValue().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Double parseCoordinate(JsonNode val, Long uniqueKey) {
        if (val == null || val.isNull()) return null;
        if (val.isNumber()) return finiteOrNull(val.doubleValue(), val, uniqueKey);
        if (!val.isTextual()) return nonNumeric(val, uniqueKey);
        String text = val.textValue();
        if (text.isBlank()) return null;
        try {
            return finiteOrNull(Double.parseDouble(text.trim()), val, uniqueKey);
        } catch (NumberFormatException e) {
            return nonNumeric(val, uniqueKey);
        }
    }

    private Double finiteOrNull(double parsed, JsonNode val, Long uniqueKey) {
        return Double.isNaN(parsed) || Double.isInfinite(parsed) ? nonNumeric(val, uniqueKey) : parsed;
    }

    private Double nonNumeric(JsonNode val, Long uniqueKey) {
        log.warn("Non-numeric coordinate '{}' on record {}, storing null", val, uniqueKey);
        return null;
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}

package com.civicintel.servicerequest.model;

import lombok.Builder;
import lombok.Data;

/**
 * Normalised service request ready for the fact table.
 *
 * Dimension values are carried as labels; they are swapped for surrogate ids
 * by the DimensionResolver at write time.
 */
@Data
@Builder
public class ServiceRequest {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Natural key assigned by the city. Upserts are keyed on it. */
    private Long uniqueKey;

    // ── Time ────────────────────────────────────────────────────────────────
    /** UTC ISO-8601 with offset, or the raw value when it could not be parsed */
    private String createdDate;

    private String closedDate;

    // ── Detail ──────────────────────────────────────────────────────────────
    private String resolutionDescription;

    private String incidentZip;

    private Double latitude;

    private Double longitude;

    // ── Dimension labels ────────────────────────────────────────────────────
    private String agency;

    private String complaintType;

    private String descriptor;

    private String borough;
}

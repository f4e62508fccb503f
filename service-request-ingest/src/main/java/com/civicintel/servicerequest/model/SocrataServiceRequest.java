package com.civicintel.servicerequest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw DTO matching one element of the Socrata erm2-nwe9 JSON array.
 * Kept separate from the domain model to isolate API coupling.
 *
 * Socrata serialises every column as a string, including unique_key and the
 * coordinates. Those three are bound as raw nodes so one malformed value (an
 * object, an array) is left to the mapper instead of failing the whole page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SocrataServiceRequest {

    @JsonProperty("unique_key")
    private JsonNode uniqueKey;

    @JsonProperty("created_date")
    private String createdDate;

    @JsonProperty("closed_date")
    private String closedDate;

    @JsonProperty("resolution_description")
    private String resolutionDescription;

    @JsonProperty("incident_zip")
    private String incidentZip;

    private JsonNode latitude;

    private JsonNode longitude;

    private String agency;

    @JsonProperty("complaint_type")
    private String complaintType;

    private String descriptor;

    private String borough;
}

package com.civicintel.servicerequest.service;

import com.civicintel.servicerequest.model.ServiceRequest;
import com.civicintel.servicerequest.model.SocrataServiceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceRequestMapperTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ServiceRequestMapper mapper = new ServiceRequestMapper(new DateNormalizer());

    private static JsonNode text(String value) {
        return value == null ? null : NODES.textNode(value);
    }

    private static SocrataServiceRequest.SocrataServiceRequestBuilder validRaw() {
        return SocrataServiceRequest.builder()
                .uniqueKey(text("59893919"))
                .createdDate("2024-01-07T00:00:12.000")
                .closedDate("2024-01-07T01:15:30.250")
                .resolutionDescription("The Police Department responded to the complaint.")
                .incidentZip("11226")
                .latitude(text("40.64823"))
                .longitude(text("-73.95785"))
                .agency("NYPD")
                .complaintType("Noise - Residential")
                .descriptor("Loud Music/Party")
                .borough("BROOKLYN");
    }

    @Test
    @DisplayName("Valid record is mapped with normalised dates and parsed coordinates")
    void mapsValidRecord() {
        ServiceRequest request = mapper.map(validRaw().build()).orElseThrow();

        assertThat(request.getUniqueKey()).isEqualTo(59893919L);
        assertThat(request.getCreatedDate()).isEqualTo("2024-01-07T00:00:12+00:00");
        assertThat(request.getClosedDate()).isEqualTo("2024-01-07T01:15:30.250000+00:00");
        assertThat(request.getIncidentZip()).isEqualTo("11226");
        assertThat(request.getLatitude()).isEqualTo(40.64823);
        assertThat(request.getLongitude()).isEqualTo(-73.95785);
        assertThat(request.getAgency()).isEqualTo("NYPD");
        assertThat(request.getComplaintType()).isEqualTo("Noise - Residential");
        assertThat(request.getDescriptor()).isEqualTo("Loud Music/Party");
        assertThat(request.getBorough()).isEqualTo("BROOKLYN");
    }

    @Test
    void keyWithSurroundingWhitespaceIsAccepted() {
        assertThat(mapper.map(validRaw().uniqueKey(text(" 42 ")).build()))
                .map(ServiceRequest::getUniqueKey)
                .contains(42L);
    }

    @Test
    @DisplayName("Missing, blank or non-numeric unique_key → record skipped")
    void unusableKeySkipsRecord() {
        assertThat(mapper.map(validRaw().uniqueKey(null).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(text("  ")).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(text("ABC-123")).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(text("12.5")).build())).isEmpty();
    }

    @Test
    @DisplayName("Missing created_date → record skipped")
    void missingCreatedDateSkipsRecord() {
        assertThat(mapper.map(validRaw().createdDate(null).build())).isEmpty();
        assertThat(mapper.map(validRaw().createdDate("").build())).isEmpty();
    }

    @Test
    @DisplayName("Malformed created_date is kept verbatim")
    void malformedCreatedDateKept() {
        Optional<ServiceRequest> request = mapper.map(validRaw().createdDate("01/07/2024 12:00:00 AM").build());
        assertThat(request).map(ServiceRequest::getCreatedDate).contains("01/07/2024 12:00:00 AM");
    }

    @Test
    @DisplayName("Non-numeric coordinates become null, record kept")
    void badCoordinatesNulled() {
        ServiceRequest request = mapper.map(validRaw().latitude(text("north-ish")).longitude(text("NaN")).build()).orElseThrow();

        assertThat(request.getLatitude()).isNull();
        assertThat(request.getLongitude()).isNull();
        assertThat(request.getUniqueKey()).isEqualTo(59893919L);
    }

    @Test
    void coordinatesAreIndependentlyNullable() {
        ServiceRequest request = mapper.map(validRaw().latitude(null).build()).orElseThrow();

        assertThat(request.getLatitude()).isNull();
        assertThat(request.getLongitude()).isEqualTo(-73.95785);
    }

    @Test
    void blankOptionalTextBecomesNull() {
        ServiceRequest request = mapper.map(validRaw()
                .closedDate(null)
                .incidentZip("")
                .resolutionDescription(" ")
                .build()).orElseThrow();

        assertThat(request.getClosedDate()).isNull();
        assertThat(request.getIncidentZip()).isNull();
        assertThat(request.getResolutionDescription()).isNull();
    }

    @Test
    @DisplayName("JSON numbers are accepted for the key and coordinates")
    void numericNodesAccepted() {
        ServiceRequest request = mapper.map(validRaw()
                .uniqueKey(NODES.numberNode(424242L))
                .latitude(NODES.numberNode(40.5))
                .longitude(NODES.numberNode(-74))
                .build()).orElseThrow();

        assertThat(request.getUniqueKey()).isEqualTo(424242L);
        assertThat(request.getLatitude()).isEqualTo(40.5);
        assertThat(request.getLongitude()).isEqualTo(-74.0);
    }

    @Test
    @DisplayName("Object or array key → record skipped")
    void structuredKeySkipsRecord() {
        assertThat(mapper.map(validRaw().uniqueKey(NODES.objectNode().put("id", "1")).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(NODES.arrayNode().add(1)).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(NODES.numberNode(12.5)).build())).isEmpty();
        assertThat(mapper.map(validRaw().uniqueKey(NODES.booleanNode(true)).build())).isEmpty();
    }

    @Test
    @DisplayName("Object or array coordinates become null, record kept")
    void structuredCoordinatesNulled() {
        ServiceRequest request = mapper.map(validRaw()
                .latitude(NODES.objectNode().put("type", "Point"))
                .longitude(NODES.arrayNode().add(-73.9))
                .build()).orElseThrow();

        assertThat(request.getLatitude()).isNull();
        assertThat(request.getLongitude()).isNull();
    }

    @Test
    void jsonNullCoordinateIsNull() {
        ServiceRequest request = mapper.map(validRaw().latitude(NODES.nullNode()).build()).orElseThrow();

        assertThat(request.getLatitude()).isNull();
        assertThat(request.getLongitude()).isEqualTo(-73.95785);
    }
}

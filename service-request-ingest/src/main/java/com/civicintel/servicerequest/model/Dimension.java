package com.civicintel.servicerequest.model;

import java.util.function.Function;

/**
 * The four lookup tables hanging off service_requests.
 * Each has a surrogate integer id and a unique text name.
 */
public enum Dimension {

    AGENCY("agency", "agency_id", ServiceRequest::getAgency),
    COMPLAINT_TYPE("complaint_type", "complaint_type_id", ServiceRequest::getComplaintType),
    DESCRIPTOR("descriptor", "descriptor_id", ServiceRequest::getDescriptor),
    BOROUGH("borough", "borough_id", ServiceRequest::getBorough);

    private final String tableName;
    private final String foreignKeyColumn;
    private final Function<ServiceRequest, String> labelExtractor;

    Dimension(String tableName, String foreignKeyColumn, Function<ServiceRequest, String> labelExtractor) {
        this.tableName = tableName;
        this.foreignKeyColumn = foreignKeyColumn;
        this.labelExtractor = labelExtractor;
    }

    public String tableName() {
        return tableName;
    }

    public String foreignKeyColumn() {
        return foreignKeyColumn;
    }

    public String labelOf(ServiceRequest request) {
        return labelExtractor.apply(request);
    }
}

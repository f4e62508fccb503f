package com.civicintel.servicerequest.service;

public class IngestionAlreadyRunningException extends RuntimeException {

    public IngestionAlreadyRunningException(String message) {
        super(message);
    }
}

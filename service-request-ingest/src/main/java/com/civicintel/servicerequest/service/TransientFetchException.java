package com.civicintel.servicerequest.service;

/**
 * A Socrata call failed in a way worth retrying: non-2xx status, I/O error,
 * or a body that is not the expected JSON.
 */
public class TransientFetchException extends RuntimeException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

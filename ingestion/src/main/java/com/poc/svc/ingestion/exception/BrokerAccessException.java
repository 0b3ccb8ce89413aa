package com.poc.svc.ingestion.exception;

public class BrokerAccessException extends RuntimeException {

    public BrokerAccessException(String message) {
        super(message);
    }

    public BrokerAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

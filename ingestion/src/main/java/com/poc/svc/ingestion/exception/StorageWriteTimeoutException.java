package com.poc.svc.ingestion.exception;

import org.springframework.dao.QueryTimeoutException;

public class StorageWriteTimeoutException extends QueryTimeoutException {

    public StorageWriteTimeoutException(String msg) {
        super(msg);
    }

    public StorageWriteTimeoutException(String msg, Throwable cause) {
        super(msg, cause);
    }
}

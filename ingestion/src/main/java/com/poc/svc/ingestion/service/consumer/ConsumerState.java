package com.poc.svc.ingestion.service.consumer;

public enum ConsumerState {
    CREATED,
    RUNNING,
    RECONNECTING,
    STOPPING,
    STOPPED,
    CANCELLED
}

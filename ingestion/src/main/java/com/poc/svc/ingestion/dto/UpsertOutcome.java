package com.poc.svc.ingestion.dto;

public enum UpsertOutcome {
    INSERTED,
    REPLACED,
    UNCHANGED,
    STALE_SKIPPED
}

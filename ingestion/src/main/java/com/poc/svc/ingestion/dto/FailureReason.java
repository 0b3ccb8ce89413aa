package com.poc.svc.ingestion.dto;

/**
 * 訊息處理失敗的分類。{@link #code()} 會寫入 dead letter 的 failure_reason 欄位。
 */
public enum FailureReason {

    MALFORMED_PAYLOAD("MalformedPayload", Kind.TERMINAL),
    UNKNOWN_COLLECTION("UnknownCollection", Kind.TERMINAL),
    MISSING_IDENTIFIER("MissingIdentifier", Kind.TERMINAL),
    SCHEMA_MISMATCH("SchemaMismatch", Kind.TERMINAL),
    STORAGE_UNAVAILABLE("StorageUnavailable", Kind.RETRYABLE),
    STORAGE_TIMEOUT("StorageTimeout", Kind.RETRYABLE),
    STORAGE_CONSTRAINT_VIOLATION("StorageConstraintViolation", Kind.FATAL);

    public enum Kind {
        TERMINAL,
        RETRYABLE,
        FATAL
    }

    private final String code;
    private final Kind kind;

    FailureReason(String code, Kind kind) {
        this.code = code;
        this.kind = kind;
    }

    public String code() {
        return code;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }
}

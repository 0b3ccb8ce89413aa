package com.poc.svc.ingestion.dto;

import java.util.Objects;

public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    static ValidationResult valid(IngestionRecord record) {
        return new Valid(record);
    }

    static ValidationResult invalid(FailureReason reason, String field, String detail) {
        return new Invalid(reason, field, detail);
    }

    record Valid(IngestionRecord record) implements ValidationResult {
        public Valid {
            Objects.requireNonNull(record, "record must not be null");
        }
    }

    record Invalid(FailureReason reason, String field, String detail) implements ValidationResult {
        public Invalid {
            Objects.requireNonNull(reason, "reason must not be null");
            if (reason.kind() != FailureReason.Kind.TERMINAL) {
                throw new IllegalArgumentException("validation failures must be terminal: " + reason);
            }
        }
    }
}

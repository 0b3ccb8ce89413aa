package com.poc.svc.ingestion.dto;

import java.util.Objects;

/**
 * Storage Writer 的寫入結果，不會以例外形式跨出元件邊界。
 */
public sealed interface PersistResult permits PersistResult.Stored, PersistResult.Retryable, PersistResult.Fatal {

    record Stored(String documentKey, UpsertOutcome outcome) implements PersistResult {
        public Stored {
            Objects.requireNonNull(documentKey, "documentKey must not be null");
            Objects.requireNonNull(outcome, "outcome must not be null");
        }
    }

    record Retryable(FailureReason reason, Throwable cause) implements PersistResult {
        public Retryable {
            Objects.requireNonNull(reason, "reason must not be null");
            if (!reason.isRetryable()) {
                throw new IllegalArgumentException("not a retryable reason: " + reason);
            }
        }
    }

    record Fatal(FailureReason reason, Throwable cause) implements PersistResult {
        public Fatal {
            Objects.requireNonNull(reason, "reason must not be null");
            if (reason.kind() != FailureReason.Kind.FATAL) {
                throw new IllegalArgumentException("not a fatal reason: " + reason);
            }
        }
    }
}

package com.poc.svc.ingestion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * 寫入 dead-letter queue 的內容。進入 DLQ 後不會自動回到 pipeline。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeadLetter(
        @JsonProperty("original_message") String originalMessage,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("failure_detail") String failureDetail,
        @JsonProperty("field") String field,
        @JsonProperty("source_queue") String sourceQueue,
        @JsonProperty("message_id") String messageId,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("failed_at") Instant failedAt
) {

    public DeadLetter {
        Objects.requireNonNull(originalMessage, "originalMessage must not be null");
        Objects.requireNonNull(failureReason, "failureReason must not be null");
        Objects.requireNonNull(sourceQueue, "sourceQueue must not be null");
        Objects.requireNonNull(failedAt, "failedAt must not be null");
    }

    public static DeadLetter of(InboundMessage message,
                                FailureReason reason,
                                String field,
                                String detail,
                                int attempts,
                                Instant failedAt) {
        return new DeadLetter(
                message.bodyAsString(),
                reason.code(),
                detail,
                field,
                message.queue(),
                message.messageId(),
                attempts,
                failedAt
        );
    }
}

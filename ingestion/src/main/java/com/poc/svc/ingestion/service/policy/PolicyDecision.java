package com.poc.svc.ingestion.service.policy;

import com.poc.svc.ingestion.dto.FailureReason;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry/Dead-Letter Policy 的判斷結果，由 consumer 轉譯成 broker 動作。
 */
public sealed interface PolicyDecision
        permits PolicyDecision.Acknowledge, PolicyDecision.ScheduleRetry, PolicyDecision.DeadLetter {

    DeliveryState targetState();

    record Acknowledge() implements PolicyDecision {
        @Override
        public DeliveryState targetState() {
            return DeliveryState.ACKNOWLEDGED;
        }
    }

    record ScheduleRetry(FailureReason reason, Duration delay, int retryIndex) implements PolicyDecision {
        public ScheduleRetry {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(delay, "delay must not be null");
        }

        @Override
        public DeliveryState targetState() {
            return DeliveryState.RETRY_SCHEDULED;
        }
    }

    record DeadLetter(FailureReason reason, String field, String detail, int attempts) implements PolicyDecision {
        public DeadLetter {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public DeliveryState targetState() {
            return DeliveryState.DEAD_LETTERED;
        }
    }
}

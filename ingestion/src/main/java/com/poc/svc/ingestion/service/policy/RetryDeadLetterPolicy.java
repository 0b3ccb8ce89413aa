package com.poc.svc.ingestion.service.policy;

import com.poc.svc.ingestion.config.RetryPolicyProperties;
import com.poc.svc.ingestion.dto.PersistResult;
import com.poc.svc.ingestion.dto.ValidationResult;

import java.util.Objects;

/**
 * 把 Validator / Storage Writer 的分類結果轉成唯一的處置：ack、延遲後 requeue、或送往 DLQ。
 * <ul>
 *     <li>驗證失敗一律直接 dead-letter，不重試。</li>
 *     <li>Retryable：第 n 次嘗試（首次為 0）且 n &lt; maxRetries 時排程重試，否則 dead-letter。</li>
 *     <li>Fatal：直接 dead-letter。</li>
 * </ul>
 * 不接觸 broker，可單獨測試。
 */
public class RetryDeadLetterPolicy {

    private final int maxRetries;
    private final BackoffSchedule backoffSchedule;

    public RetryDeadLetterPolicy(RetryPolicyProperties properties) {
        this(properties.getMaxRetries(), BackoffSchedule.from(properties));
    }

    public RetryDeadLetterPolicy(int maxRetries, BackoffSchedule backoffSchedule) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.backoffSchedule = Objects.requireNonNull(backoffSchedule, "backoffSchedule must not be null");
    }

    public int maxRetries() {
        return maxRetries;
    }

    public PolicyDecision.DeadLetter onRejected(ValidationResult.Invalid invalid) {
        Objects.requireNonNull(invalid, "invalid must not be null");
        return new PolicyDecision.DeadLetter(invalid.reason(), invalid.field(), invalid.detail(), 1);
    }

    public PolicyDecision onPersisted(PersistResult result, int attemptIndex) {
        Objects.requireNonNull(result, "result must not be null");
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0");
        }
        if (result instanceof PersistResult.Stored) {
            return new PolicyDecision.Acknowledge();
        }
        if (result instanceof PersistResult.Retryable retryable) {
            if (attemptIndex < maxRetries) {
                return new PolicyDecision.ScheduleRetry(retryable.reason(), backoffSchedule.delayFor(attemptIndex), attemptIndex);
            }
            return new PolicyDecision.DeadLetter(
                    retryable.reason(),
                    null,
                    "Retries exhausted after %d attempts: %s".formatted(attemptIndex + 1, describe(retryable.cause())),
                    attemptIndex + 1);
        }
        PersistResult.Fatal fatal = (PersistResult.Fatal) result;
        return new PolicyDecision.DeadLetter(fatal.reason(), null, describe(fatal.cause()), attemptIndex + 1);
    }

    private String describe(Throwable cause) {
        if (cause == null) {
            return null;
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

package com.poc.svc.ingestion.service.consumer;

import com.poc.svc.ingestion.broker.BrokerGateway;
import com.poc.svc.ingestion.broker.DeadLetterPublisher;
import com.poc.svc.ingestion.broker.QueueSession;
import com.poc.svc.ingestion.config.MetricsConfig;
import com.poc.svc.ingestion.dto.ConsumerHealth;
import com.poc.svc.ingestion.dto.DeadLetter;
import com.poc.svc.ingestion.dto.InboundMessage;
import com.poc.svc.ingestion.dto.PersistResult;
import com.poc.svc.ingestion.dto.ValidationResult;
import com.poc.svc.ingestion.exception.BrokerAccessException;
import com.poc.svc.ingestion.service.MessageValidator;
import com.poc.svc.ingestion.service.StorageWriter;
import com.poc.svc.ingestion.service.policy.DeliveryState;
import com.poc.svc.ingestion.service.policy.DeliveryStateMachine;
import com.poc.svc.ingestion.service.policy.PolicyDecision;
import com.poc.svc.ingestion.service.policy.RetryDeadLetterPolicy;
import com.poc.svc.ingestion.util.TraceContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 綁定單一 queue 的循序處理 loop：poll -> validate -> persist -> policy -> ack | requeue | dead-letter。
 * 同一時間最多只有一則 in-flight 訊息，只有在 ACKNOWLEDGED 或 DEAD_LETTERED 時才 ack。
 */
public class QueueConsumer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueConsumer.class);

    public record Settings(Duration pollInterval,
                           Duration reconnectDelay,
                           Duration maxReconnectDelay,
                           String deadLetterQueue) {

        public Settings {
            Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");
            Objects.requireNonNull(maxReconnectDelay, "maxReconnectDelay must not be null");
            Objects.requireNonNull(deadLetterQueue, "deadLetterQueue must not be null");
        }

        Duration reconnectDelayFor(int attempt) {
            long millis = reconnectDelay.toMillis() << Math.min(attempt, 16);
            return millis <= 0 || millis >= maxReconnectDelay.toMillis()
                    ? maxReconnectDelay
                    : Duration.ofMillis(millis);
        }
    }

    private final String queue;
    private final BrokerGateway brokerGateway;
    private final MessageValidator validator;
    private final StorageWriter storageWriter;
    private final RetryDeadLetterPolicy policy;
    private final DeadLetterPublisher deadLetterPublisher;
    private final BackoffSleeper sleeper;
    private final Settings settings;
    private final Clock clock;

    private final StopSignal stopSignal = new StopSignal();
    private final RedeliveryTracker redeliveryTracker = new RedeliveryTracker();

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong redeliveryPending = new AtomicLong();

    private final MeterRegistry meterRegistry;
    private final Counter acknowledgedCounter;
    private final Counter deadLetteredCounter;
    private final Counter retriedCounter;
    private final Counter redeliveryPendingCounter;

    private volatile ConsumerState state = ConsumerState.CREATED;
    private volatile Instant lastProgressAt;
    private QueueSession session;

    public QueueConsumer(String queue,
                         BrokerGateway brokerGateway,
                         MessageValidator validator,
                         StorageWriter storageWriter,
                         RetryDeadLetterPolicy policy,
                         DeadLetterPublisher deadLetterPublisher,
                         BackoffSleeper sleeper,
                         Settings settings,
                         Clock clock,
                         MeterRegistry meterRegistry) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.brokerGateway = Objects.requireNonNull(brokerGateway, "brokerGateway must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.storageWriter = Objects.requireNonNull(storageWriter, "storageWriter must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.deadLetterPublisher = Objects.requireNonNull(deadLetterPublisher, "deadLetterPublisher must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.acknowledgedCounter = outcomeCounter(MetricsConfig.OUTCOME_ACKNOWLEDGED);
        this.deadLetteredCounter = outcomeCounter(MetricsConfig.OUTCOME_DEAD_LETTERED);
        this.retriedCounter = outcomeCounter(MetricsConfig.OUTCOME_RETRIED);
        this.redeliveryPendingCounter = outcomeCounter(MetricsConfig.OUTCOME_REDELIVERY_PENDING);
        this.lastProgressAt = clock.instant();
    }

    public String queue() {
        return queue;
    }

    public ConsumerState state() {
        return state;
    }

    public Instant lastProgressAt() {
        return lastProgressAt;
    }

    /**
     * 要求 consumer 處理完目前訊息後結束，不會中斷進行中的寫入。
     */
    public void requestStop() {
        if (state == ConsumerState.RUNNING || state == ConsumerState.RECONNECTING) {
            state = ConsumerState.STOPPING;
        }
        stopSignal.raise();
    }

    void markCancelled() {
        state = ConsumerState.CANCELLED;
    }

    public ConsumerHealth snapshot(boolean alive, boolean healthy) {
        return new ConsumerHealth(
                queue,
                state.name(),
                healthy,
                alive,
                lastProgressAt,
                processed.get(),
                acknowledged.get(),
                deadLettered.get(),
                retried.get(),
                redeliveryPending.get()
        );
    }

    @Override
    public void run() {
        TraceContext.bindQueue(queue);
        if (!stopSignal.isRaised()) {
            state = ConsumerState.RUNNING;
        }
        log.info("Consumer started queue={}", queue);
        int reconnectAttempt = 0;
        try {
            while (!stopSignal.isRaised() && !Thread.currentThread().isInterrupted()) {
                boolean handled;
                try {
                    handled = processNext();
                } catch (BrokerAccessException ex) {
                    Duration delay = settings.reconnectDelayFor(reconnectAttempt++);
                    log.warn("Broker unavailable for queue={}, reconnecting in {}ms: {}", queue, delay.toMillis(), ex.getMessage());
                    closeSession();
                    state = ConsumerState.RECONNECTING;
                    if (stopSignal.await(delay)) {
                        break;
                    }
                    continue;
                }
                if (reconnectAttempt > 0) {
                    log.info("Broker connection restored for queue={}", queue);
                    reconnectAttempt = 0;
                }
                if (state == ConsumerState.RECONNECTING) {
                    state = ConsumerState.RUNNING;
                }
                if (!handled) {
                    stopSignal.await(settings.pollInterval());
                }
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.warn("Consumer interrupted queue={}", queue);
        } finally {
            closeSession();
            if (state != ConsumerState.CANCELLED) {
                state = ConsumerState.STOPPED;
            }
            log.info("Consumer stopped queue={} processed={} acknowledged={} deadLettered={} retried={}",
                    queue, processed.get(), acknowledged.get(), deadLettered.get(), retried.get());
            TraceContext.clear();
        }
    }

    /**
     * 拉取並處理一則訊息。
     *
     * @return queue 為空時回傳 false
     * @throws BrokerAccessException poll 失敗，由呼叫端負責重新連線
     */
    boolean processNext() {
        Optional<InboundMessage> next = currentSession().poll();
        markProgress();
        if (next.isEmpty()) {
            return false;
        }
        handle(next.get());
        return true;
    }

    /**
     * 處理單則訊息直到 terminal 轉移或 requeue。broker 端錯誤不會被視為訊息本身的失敗。
     */
    private void handle(InboundMessage message) {
        TraceContext.bindMessage(message.messageId());
        processed.incrementAndGet();
        DeliveryStateMachine delivery = new DeliveryStateMachine();
        try {
            delivery.transitionTo(DeliveryState.VALIDATING);
            ValidationResult validation = validator.validate(message);
            if (validation instanceof ValidationResult.Invalid invalid) {
                delivery.transitionTo(DeliveryState.REJECTED);
                deadLetter(message, policy.onRejected(invalid), delivery);
                return;
            }
            ValidationResult.Valid valid = (ValidationResult.Valid) validation;
            TraceContext.bindProductCode(valid.record().productCode());
            delivery.transitionTo(DeliveryState.PERSISTING);
            int attemptIndex = redeliveryTracker.attemptIndex(message);
            PersistResult persisted = storageWriter.persist(valid.record());
            PolicyDecision decision = policy.onPersisted(persisted, attemptIndex);
            if (decision instanceof PolicyDecision.Acknowledge) {
                acknowledge(message, persisted, delivery);
            } else if (decision instanceof PolicyDecision.ScheduleRetry retry) {
                scheduleRetry(message, retry, delivery);
            } else {
                deadLetter(message, (PolicyDecision.DeadLetter) decision, delivery);
            }
        } catch (BrokerAccessException ex) {
            log.error("Broker operation failed for messageId={} in state={}, leaving it for redelivery",
                    message.messageId(), delivery.current(), ex);
            leaveForRedelivery();
            recycleSession();
        } catch (RuntimeException ex) {
            log.error("Unexpected error for messageId={} in state={}, leaving it for redelivery",
                    message.messageId(), delivery.current(), ex);
            leaveForRedelivery();
            recycleSession();
        } finally {
            markProgress();
            TraceContext.unbindMessage();
        }
    }

    private void acknowledge(InboundMessage message, PersistResult persisted, DeliveryStateMachine delivery) {
        currentSession().ack(message);
        delivery.transitionTo(DeliveryState.ACKNOWLEDGED);
        redeliveryTracker.forget(message.messageId());
        acknowledged.incrementAndGet();
        acknowledgedCounter.increment();
        PersistResult.Stored stored = (PersistResult.Stored) persisted;
        log.info("Acknowledged document={} outcome={}", stored.documentKey(), stored.outcome());
    }

    private void scheduleRetry(InboundMessage message, PolicyDecision.ScheduleRetry retry, DeliveryStateMachine delivery) {
        log.warn("Retrying messageId={} reason={} retry={}/{} in {}ms",
                message.messageId(), retry.reason().code(), retry.retryIndex() + 1, policy.maxRetries(), retry.delay().toMillis());
        redeliveryTracker.recordRetry(message.messageId(), retry.retryIndex());
        try {
            if (!sleeper.sleep(retry.delay(), stopSignal)) {
                log.info("Backoff interrupted by stop, requeueing messageId={} now", message.messageId());
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.info("Backoff interrupted, requeueing messageId={} now", message.messageId());
        }
        currentSession().requeue(message);
        delivery.transitionTo(DeliveryState.RETRY_SCHEDULED);
        retried.incrementAndGet();
        retriedCounter.increment();
    }

    private void deadLetter(InboundMessage message, PolicyDecision.DeadLetter decision, DeliveryStateMachine delivery) {
        String deadLetterQueue = settings.deadLetterQueue();
        DeadLetter deadLetter = DeadLetter.of(
                message,
                decision.reason(),
                decision.field(),
                decision.detail(),
                decision.attempts(),
                clock.instant());
        deadLetterPublisher.publish(deadLetterQueue, deadLetter);
        currentSession().ack(message);
        delivery.transitionTo(DeliveryState.DEAD_LETTERED);
        redeliveryTracker.forget(message.messageId());
        deadLettered.incrementAndGet();
        deadLetteredCounter.increment();
        meterRegistry.counter(MetricsConfig.INGESTION_DEAD_LETTERS, "queue", queue, "reason", decision.reason().code()).increment();
        log.warn("Dead-lettered messageId={} to {} reason={} field={} attempts={} detail={}",
                message.messageId(), deadLetterQueue, decision.reason().code(), decision.field(), decision.attempts(), decision.detail());
    }

    private void leaveForRedelivery() {
        redeliveryPending.incrementAndGet();
        redeliveryPendingCounter.increment();
    }

    private QueueSession currentSession() {
        if (session == null || !session.isOpen()) {
            closeSession();
            session = brokerGateway.open(queue);
        }
        return session;
    }

    private void recycleSession() {
        if (session == null) {
            return;
        }
        try {
            session.recover();
        } catch (BrokerAccessException ex) {
            log.warn("Recover failed for queue={}, closing channel: {}", queue, ex.getMessage());
        }
        closeSession();
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    private void markProgress() {
        lastProgressAt = clock.instant();
    }

    private Counter outcomeCounter(String outcome) {
        return Counter.builder(MetricsConfig.INGESTION_MESSAGES)
                .description("依處理結果統計的訊息數")
                .tag("queue", queue)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}

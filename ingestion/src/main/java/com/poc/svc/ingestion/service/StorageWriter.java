package com.poc.svc.ingestion.service;

import com.poc.svc.ingestion.config.IngestionProperties;
import com.poc.svc.ingestion.config.MetricsConfig;
import com.poc.svc.ingestion.config.StorageExecutorConfig;
import com.poc.svc.ingestion.dto.FailureReason;
import com.poc.svc.ingestion.dto.IngestionRecord;
import com.poc.svc.ingestion.dto.PersistResult;
import com.poc.svc.ingestion.dto.UpsertOutcome;
import com.poc.svc.ingestion.entity.StoredDocument;
import com.poc.svc.ingestion.exception.StorageWriteTimeoutException;
import com.poc.svc.ingestion.repository.StoredDocumentRepository;
import com.poc.svc.ingestion.service.impl.support.StorageFailureClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 將通過驗證的 record upsert 至 MongoDB，並把失敗分類為 Retryable 或 Fatal。
 * 寫入在 write-timeout 內未開始即放棄並視為 StorageTimeout；已開始的寫入由 driver 的 socket timeout 界定，
 * 回報其實際結果。
 */
@Service
public class StorageWriter {

    private static final Logger log = LoggerFactory.getLogger(StorageWriter.class);

    private final StoredDocumentRepository repository;
    private final StorageFailureClassifier classifier;
    private final Executor storeWriteExecutor;
    private final Duration writeTimeout;
    private final Timer writeLatencyTimer;

    @Autowired
    public StorageWriter(StoredDocumentRepository repository,
                         StorageFailureClassifier classifier,
                         @Qualifier(StorageExecutorConfig.STORE_WRITE_EXECUTOR) Executor storeWriteExecutor,
                         IngestionProperties properties,
                         MeterRegistry meterRegistry) {
        this(repository, classifier, storeWriteExecutor, properties.getStorage().getWriteTimeout(), meterRegistry);
    }

    public StorageWriter(StoredDocumentRepository repository,
                         StorageFailureClassifier classifier,
                         Executor storeWriteExecutor,
                         Duration writeTimeout,
                         MeterRegistry meterRegistry) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.storeWriteExecutor = Objects.requireNonNull(storeWriteExecutor, "storeWriteExecutor must not be null");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout must not be null");
        this.writeLatencyTimer = MetricsConfig.storeWriteTimer(Objects.requireNonNull(meterRegistry, "meterRegistry must not be null"));
    }

    public PersistResult persist(IngestionRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        StoredDocument document = StoredDocument.from(record);
        String documentKey = document.documentKey();
        WriteAttempt attempt = new WriteAttempt(document);
        long started = System.nanoTime();
        try {
            CompletableFuture<UpsertOutcome> write = CompletableFuture.supplyAsync(attempt::run, storeWriteExecutor);
            UpsertOutcome outcome;
            try {
                outcome = write.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException timeout) {
                if (attempt.abandon()) {
                    log.warn("Upsert of document={} not started within {}ms, abandoned", documentKey, writeTimeout.toMillis());
                    return new PersistResult.Retryable(
                            FailureReason.STORAGE_TIMEOUT,
                            new StorageWriteTimeoutException("Upsert of %s exceeded %dms".formatted(documentKey, writeTimeout.toMillis()), timeout));
                }
                // 已送出的寫入可能已落地，等 driver 的 socket timeout 給出真正結果
                log.warn("Upsert of document={} still in flight after {}ms, awaiting driver result", documentKey, writeTimeout.toMillis());
                outcome = write.get();
            }
            log.debug("Upserted document={} outcome={}", documentKey, outcome);
            return new PersistResult.Stored(documentKey, outcome);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() != null ? executionException.getCause() : executionException;
            return classified(documentKey, cause);
        } catch (RejectedExecutionException rejected) {
            attempt.abandon();
            return classified(documentKey, rejected);
        } catch (InterruptedException interrupted) {
            attempt.abandon();
            Thread.currentThread().interrupt();
            return new PersistResult.Retryable(FailureReason.STORAGE_UNAVAILABLE, interrupted);
        } finally {
            writeLatencyTimer.record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        }
    }

    private PersistResult classified(String documentKey, Throwable cause) {
        FailureReason reason = classifier.classify(cause);
        log.warn("Upsert of document={} failed reason={} error={}", documentKey, reason.code(), cause.toString());
        if (reason.isRetryable()) {
            return new PersistResult.Retryable(reason, cause);
        }
        return new PersistResult.Fatal(reason, cause);
    }

    private enum AttemptState { PENDING, RUNNING, ABANDONED }

    /**
     * 單次寫入嘗試。被放棄後即使 executor 取到也不會呼叫 repository。
     */
    private final class WriteAttempt {

        private final StoredDocument document;
        private final AtomicReference<AttemptState> state = new AtomicReference<>(AttemptState.PENDING);

        private WriteAttempt(StoredDocument document) {
            this.document = document;
        }

        UpsertOutcome run() {
            if (!state.compareAndSet(AttemptState.PENDING, AttemptState.RUNNING)) {
                log.debug("Skipping abandoned upsert of document={}", document.documentKey());
                return null;
            }
            return repository.upsert(document);
        }

        boolean abandon() {
            return state.compareAndSet(AttemptState.PENDING, AttemptState.ABANDONED);
        }
    }
}

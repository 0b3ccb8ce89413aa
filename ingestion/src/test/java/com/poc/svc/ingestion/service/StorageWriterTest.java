package com.poc.svc.ingestion.service;

import com.mongodb.MongoSocketOpenException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.ServerAddress;
import com.poc.svc.ingestion.config.MetricsConfig;
import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.dto.FailureReason;
import com.poc.svc.ingestion.dto.IngestionRecord;
import com.poc.svc.ingestion.dto.PersistResult;
import com.poc.svc.ingestion.dto.UpsertOutcome;
import com.poc.svc.ingestion.entity.StoredDocument;
import com.poc.svc.ingestion.exception.StorageWriteTimeoutException;
import com.poc.svc.ingestion.repository.StoredDocumentRepository;
import com.poc.svc.ingestion.service.impl.support.StorageFailureClassifier;
import com.poc.svc.ingestion.support.InMemoryStoredDocumentRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StorageWriterTest {

    private static final IngestionRecord WIDGET = new IngestionRecord(
            CollectionName.PRODUCTS,
            "P-1",
            Map.of("name", "Widget", "currency", "USD"),
            Instant.parse("2025-01-01T00:00:00Z"));

    @Mock
    private StoredDocumentRepository repository;

    private SimpleMeterRegistry meterRegistry;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        meterRegistry.close();
    }

    @Test
    @DisplayName("stores the record as a document keyed by product code")
    void persist_success() {
        when(repository.upsert(any(StoredDocument.class))).thenReturn(UpsertOutcome.INSERTED);

        PersistResult result = writer(repository, Duration.ofSeconds(2)).persist(WIDGET);

        assertThat(result).isEqualTo(new PersistResult.Stored("products/P-1", UpsertOutcome.INSERTED));
        ArgumentCaptor<StoredDocument> captor = ArgumentCaptor.forClass(StoredDocument.class);
        verify(repository).upsert(captor.capture());
        assertThat(captor.getValue().productCode()).isEqualTo("P-1");
        assertThat(captor.getValue().toBson().get(StoredDocument.ID)).isEqualTo("P-1");
        assertThat(meterRegistry.timer(MetricsConfig.STORE_WRITE_LATENCY).count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("writing the same record twice leaves one unchanged document")
    void persist_isIdempotent() {
        InMemoryStoredDocumentRepository store = new InMemoryStoredDocumentRepository();
        StorageWriter writer = writer(store, Duration.ofSeconds(2));

        PersistResult first = writer.persist(WIDGET);
        PersistResult second = writer.persist(WIDGET);

        assertThat(first).isEqualTo(new PersistResult.Stored("products/P-1", UpsertOutcome.INSERTED));
        assertThat(second).isEqualTo(new PersistResult.Stored("products/P-1", UpsertOutcome.UNCHANGED));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void persist_olderRecordIsSkipped() {
        InMemoryStoredDocumentRepository store = new InMemoryStoredDocumentRepository();
        StorageWriter writer = writer(store, Duration.ofSeconds(2));
        writer.persist(WIDGET);

        IngestionRecord older = new IngestionRecord(CollectionName.PRODUCTS, "P-1",
                Map.of("name", "Old widget"), Instant.parse("2024-12-31T00:00:00Z"));

        assertThat(writer.persist(older)).isEqualTo(new PersistResult.Stored("products/P-1", UpsertOutcome.STALE_SKIPPED));
        assertThat(store.get(CollectionName.PRODUCTS, "P-1")).get()
                .extracting(document -> document.fields().get("name"))
                .isEqualTo("Widget");
    }

    @Test
    @DisplayName("a write not started within the timeout is retryable and never reaches the store")
    void persist_timeout() throws Exception {
        InMemoryStoredDocumentRepository store = new InMemoryStoredDocumentRepository();
        ExecutorService busy = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            busy.submit(() -> {
                release.await(5, TimeUnit.SECONDS);
                return null;
            });

            PersistResult result = new StorageWriter(store, new StorageFailureClassifier(), busy, Duration.ofMillis(50), meterRegistry)
                    .persist(WIDGET);
            release.countDown();
            busy.shutdown();
            assertThat(busy.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

            assertThat(result).isInstanceOf(PersistResult.Retryable.class);
            PersistResult.Retryable retryable = (PersistResult.Retryable) result;
            assertThat(retryable.reason()).isEqualTo(FailureReason.STORAGE_TIMEOUT);
            assertThat(retryable.cause()).isInstanceOf(StorageWriteTimeoutException.class);
            // executor 之後取到被放棄的嘗試也不會寫入
            assertThat(store.upsertCalls()).isZero();
            assertThat(store.get(CollectionName.PRODUCTS, "P-1")).isEmpty();
        } finally {
            busy.shutdownNow();
        }
    }

    @Test
    @DisplayName("a write already in flight at the timeout reports its real outcome")
    void persist_inFlightWriteReportsActualOutcome() {
        InMemoryStoredDocumentRepository slowStore = new InMemoryStoredDocumentRepository().beforeWrite(document -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        PersistResult result = writer(slowStore, Duration.ofMillis(50)).persist(WIDGET);

        assertThat(result).isEqualTo(new PersistResult.Stored("products/P-1", UpsertOutcome.INSERTED));
        assertThat(slowStore.get(CollectionName.PRODUCTS, "P-1")).isPresent();
        assertThat(slowStore.upsertCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("a driver timeout on an in-flight write stays retryable")
    void persist_inFlightDriverTimeoutIsRetryable() {
        InMemoryStoredDocumentRepository slowStore = new InMemoryStoredDocumentRepository()
                .beforeWrite(document -> {
                    try {
                        Thread.sleep(150);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                })
                .failNext(new MongoSocketReadTimeoutException("read timed out", new ServerAddress(), new IOException("slow")));

        PersistResult result = writer(slowStore, Duration.ofMillis(50)).persist(WIDGET);

        assertThat(result).isInstanceOf(PersistResult.Retryable.class);
        assertThat(((PersistResult.Retryable) result).reason()).isEqualTo(FailureReason.STORAGE_TIMEOUT);
        assertThat(slowStore.size()).isZero();
    }

    @Test
    void persist_connectivityFailureIsRetryable() {
        when(repository.upsert(any(StoredDocument.class))).thenThrow(new DataAccessResourceFailureException(
                "connection refused", new MongoSocketOpenException("Exception opening socket", new ServerAddress())));

        PersistResult result = writer(repository, Duration.ofSeconds(2)).persist(WIDGET);

        assertThat(result).isInstanceOf(PersistResult.Retryable.class);
        assertThat(((PersistResult.Retryable) result).reason()).isEqualTo(FailureReason.STORAGE_UNAVAILABLE);
    }

    @Test
    void persist_constraintViolationIsFatal() {
        when(repository.upsert(any(StoredDocument.class))).thenThrow(new DataIntegrityViolationException("document failed validation"));

        PersistResult result = writer(repository, Duration.ofSeconds(2)).persist(WIDGET);

        assertThat(result).isInstanceOf(PersistResult.Fatal.class);
        PersistResult.Fatal fatal = (PersistResult.Fatal) result;
        assertThat(fatal.reason()).isEqualTo(FailureReason.STORAGE_CONSTRAINT_VIOLATION);
        assertThat(fatal.cause()).isInstanceOf(DataIntegrityViolationException.class);
    }

    private StorageWriter writer(StoredDocumentRepository target, Duration timeout) {
        return new StorageWriter(target, new StorageFailureClassifier(), executor, timeout, meterRegistry);
    }
}

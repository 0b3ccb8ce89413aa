package com.poc.svc.ingestion.support;

import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.dto.UpsertOutcome;
import com.poc.svc.ingestion.entity.StoredDocument;
import com.poc.svc.ingestion.repository.StoredDocumentRepository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 與 Mongo 實作相同語意的記憶體 repository：每個 documentKey 一份、received_at 較舊的寫入略過。
 * 可預先排入要拋出的例外，依序消耗。
 */
public class InMemoryStoredDocumentRepository implements StoredDocumentRepository {

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final Deque<RuntimeException> scheduledFailures = new ArrayDeque<>();
    private final AtomicInteger upsertCalls = new AtomicInteger();
    private volatile RuntimeException permanentFailure;
    private volatile Consumer<StoredDocument> beforeWrite = document -> { };

    public synchronized InMemoryStoredDocumentRepository failNext(RuntimeException failure) {
        scheduledFailures.addLast(failure);
        return this;
    }

    public InMemoryStoredDocumentRepository failAlways(RuntimeException failure) {
        this.permanentFailure = failure;
        return this;
    }

    public InMemoryStoredDocumentRepository beforeWrite(Consumer<StoredDocument> hook) {
        this.beforeWrite = Objects.requireNonNull(hook);
        return this;
    }

    public int upsertCalls() {
        return upsertCalls.get();
    }

    public Optional<StoredDocument> get(CollectionName collection, String productCode) {
        return Optional.ofNullable(documents.get(collection.value() + "/" + productCode));
    }

    public int size() {
        return documents.size();
    }

    @Override
    public UpsertOutcome upsert(StoredDocument document) {
        upsertCalls.incrementAndGet();
        beforeWrite.accept(document);
        RuntimeException failure = nextFailure();
        if (failure != null) {
            throw failure;
        }
        synchronized (documents) {
            StoredDocument existing = documents.get(document.documentKey());
            if (existing == null) {
                documents.put(document.documentKey(), document);
                return UpsertOutcome.INSERTED;
            }
            if (existing.receivedAt().isAfter(document.receivedAt())) {
                return UpsertOutcome.STALE_SKIPPED;
            }
            if (existing.equals(document)) {
                return UpsertOutcome.UNCHANGED;
            }
            documents.put(document.documentKey(), document);
            return UpsertOutcome.REPLACED;
        }
    }

    @Override
    public Optional<StoredDocument> findByProductCode(CollectionName collection, String productCode) {
        return get(collection, productCode);
    }

    @Override
    public List<StoredDocument> findAll(CollectionName collection, Map<String, Object> equalityFilters, int limit) {
        return documents.values().stream()
                .filter(document -> document.collection() == collection)
                .filter(document -> equalityFilters.entrySet().stream().allMatch(filter ->
                        StoredDocument.ID.equals(filter.getKey())
                                ? document.productCode().equals(filter.getValue())
                                : Objects.equals(document.fields().get(filter.getKey()), filter.getValue())))
                .limit(limit)
                .toList();
    }

    private synchronized RuntimeException nextFailure() {
        if (!scheduledFailures.isEmpty()) {
            return scheduledFailures.pollFirst();
        }
        return permanentFailure;
    }
}

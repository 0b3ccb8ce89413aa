package com.poc.svc.ingestion.repository;

import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.dto.UpsertOutcome;
import com.poc.svc.ingestion.entity.StoredDocument;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface StoredDocumentRepository {

    /**
     * 以 (collection, product_code) 為 key 的整份取代寫入；received_at 較舊的寫入會被略過。
     */
    UpsertOutcome upsert(StoredDocument document);

    Optional<StoredDocument> findByProductCode(CollectionName collection, String productCode);

    List<StoredDocument> findAll(CollectionName collection, Map<String, Object> equalityFilters, int limit);
}

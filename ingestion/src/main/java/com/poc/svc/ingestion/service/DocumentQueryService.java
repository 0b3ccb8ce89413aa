package com.poc.svc.ingestion.service;

import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.entity.StoredDocument;
import com.poc.svc.ingestion.exception.DocumentNotFoundException;
import com.poc.svc.ingestion.repository.StoredDocumentRepository;
import com.poc.svc.ingestion.schema.FieldSpec;
import com.poc.svc.ingestion.schema.SchemaContract;
import com.poc.svc.ingestion.schema.SchemaRegistry;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 已寫入文件的唯讀查詢。篩選條件僅允許 schema 宣告的欄位，值依欄位型別轉換後做等值比對。
 */
@Service
public class DocumentQueryService {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private final StoredDocumentRepository repository;
    private final SchemaRegistry schemaRegistry;

    public DocumentQueryService(StoredDocumentRepository repository, SchemaRegistry schemaRegistry) {
        this.repository = repository;
        this.schemaRegistry = schemaRegistry;
    }

    public Map<String, Object> findByProductCode(String collection, String productCode) {
        CollectionName collectionName = resolveCollection(collection);
        return repository.findByProductCode(collectionName, productCode)
                .map(StoredDocument::toView)
                .orElseThrow(() -> new DocumentNotFoundException(collectionName, productCode));
    }

    public List<Map<String, Object>> find(String collection, Map<String, String> filters, int limit) {
        CollectionName collectionName = resolveCollection(collection);
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and %d".formatted(MAX_LIMIT));
        }
        SchemaContract contract = schemaRegistry.resolve(collectionName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + collection));
        Map<String, Object> equalityFilters = new LinkedHashMap<>();
        filters.forEach((name, raw) -> {
            if (StoredDocument.PRODUCT_CODE.equals(name)) {
                equalityFilters.put(StoredDocument.ID, raw);
                return;
            }
            FieldSpec field = contract.field(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported filter field: " + name));
            equalityFilters.put(name, field.type().parse(raw));
        });
        return repository.findAll(collectionName, equalityFilters, limit).stream()
                .map(StoredDocument::toView)
                .toList();
    }

    private CollectionName resolveCollection(String collection) {
        return CollectionName.fromValue(collection)
                .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + collection));
    }
}

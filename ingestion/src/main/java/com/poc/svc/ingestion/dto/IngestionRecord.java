package com.poc.svc.ingestion.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 通過驗證、可寫入的資料。欄位只包含 schema 宣告過的欄位。
 */
public record IngestionRecord(
        CollectionName collection,
        String productCode,
        Map<String, Object> fields,
        Instant receivedAt
) {

    public IngestionRecord {
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(productCode, "productCode must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        // optional 欄位允許 null 值
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String documentKey() {
        return collection.value() + "/" + productCode;
    }
}

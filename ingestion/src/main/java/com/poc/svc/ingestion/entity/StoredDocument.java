package com.poc.svc.ingestion.entity;

import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.dto.IngestionRecord;
import org.bson.Document;

import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB 中每個 (collection, product_code) 僅有一份的文件，_id 即為 product_code。
 * 文件內容完全由 record 決定，重複寫入同一筆 record 不會改變已存資料。
 */
public record StoredDocument(
        CollectionName collection,
        String productCode,
        Map<String, Object> fields,
        Instant receivedAt
) {

    public static final String ID = "_id";
    public static final String PRODUCT_CODE = "product_code";
    public static final String RECEIVED_AT = "received_at";

    public StoredDocument {
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(productCode, "productCode must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static StoredDocument from(IngestionRecord record) {
        return new StoredDocument(record.collection(), record.productCode(), record.fields(), record.receivedAt());
    }

    public String documentKey() {
        return collection.value() + "/" + productCode;
    }

    public Document toBson() {
        Document document = new Document(ID, productCode)
                .append(PRODUCT_CODE, productCode);
        fields.forEach(document::append);
        document.append(RECEIVED_AT, Date.from(receivedAt));
        return document;
    }

    public static StoredDocument fromBson(CollectionName collection, Document document) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        fields.remove(ID);
        fields.remove(PRODUCT_CODE);
        Object receivedAt = fields.remove(RECEIVED_AT);
        return new StoredDocument(
                collection,
                String.valueOf(document.get(PRODUCT_CODE, document.get(ID))),
                fields,
                toInstant(receivedAt)
        );
    }

    /**
     * 對外輸出用的扁平結構，與原始訊息欄位名稱一致。
     */
    public Map<String, Object> toView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("collection", collection.value());
        view.put(PRODUCT_CODE, productCode);
        view.putAll(fields);
        view.put(RECEIVED_AT, receivedAt);
        return view;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text) {
            return Instant.parse(text);
        }
        throw new IllegalStateException("Unexpected received_at value: " + value);
    }
}

package com.poc.svc.ingestion.exception;

import com.poc.svc.ingestion.dto.CollectionName;

public class DocumentNotFoundException extends RuntimeException {

    private final CollectionName collection;
    private final String productCode;

    public DocumentNotFoundException(CollectionName collection, String productCode) {
        super("Document not found: %s/%s".formatted(collection.value(), productCode));
        this.collection = collection;
        this.productCode = productCode;
    }

    public CollectionName collection() {
        return collection;
    }

    public String productCode() {
        return productCode;
    }
}

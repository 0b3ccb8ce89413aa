package com.poc.svc.ingestion.service;

import com.poc.svc.ingestion.dto.CollectionName;
import com.poc.svc.ingestion.entity.StoredDocument;
import com.poc.svc.ingestion.exception.DocumentNotFoundException;
import com.poc.svc.ingestion.schema.DefaultSchemas;
import com.poc.svc.ingestion.support.InMemoryStoredDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentQueryServiceTest {

    private static final Instant RECEIVED_AT = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryStoredDocumentRepository repository;
    private DocumentQueryService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryStoredDocumentRepository();
        service = new DocumentQueryService(repository, DefaultSchemas.registry());
        repository.upsert(new StoredDocument(CollectionName.STOCKS, "P-1",
                Map.of("warehouse_id", "W1", "quantity", 5L), RECEIVED_AT));
        repository.upsert(new StoredDocument(CollectionName.STOCKS, "P-2",
                Map.of("warehouse_id", "W2", "quantity", 5L), RECEIVED_AT));
        repository.upsert(new StoredDocument(CollectionName.PRODUCTS, "P-1",
                Map.of("name", "Widget", "currency", "USD"), RECEIVED_AT));
    }

    @Test
    void findByProductCode_returnsFlatView() {
        Map<String, Object> view = service.findByProductCode("products", "P-1");

        assertThat(view)
                .containsEntry("collection", "products")
                .containsEntry("product_code", "P-1")
                .containsEntry("name", "Widget")
                .containsEntry("received_at", RECEIVED_AT);
    }

    @Test
    void findByProductCode_missingDocumentThrows() {
        assertThatThrownBy(() -> service.findByProductCode("products", "P-404"))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessage("Document not found: products/P-404");
    }

    @Test
    @DisplayName("filter values are converted to the declared field type")
    void find_filtersByTypedValue() {
        List<Map<String, Object>> byQuantity = service.find("stocks", Map.of("quantity", "5"), 10);
        List<Map<String, Object>> byWarehouse = service.find("stocks", Map.of("warehouse_id", "W2"), 10);
        List<Map<String, Object>> byCode = service.find("stocks", Map.of("product_code", "P-1"), 10);

        assertThat(byQuantity).hasSize(2);
        assertThat(byWarehouse).singleElement().extracting(view -> view.get("product_code")).isEqualTo("P-2");
        assertThat(byCode).singleElement().extracting(view -> view.get("warehouse_id")).isEqualTo("W1");
    }

    @Test
    void find_appliesLimit() {
        assertThat(service.find("stocks", Map.of(), 1)).hasSize(1);
    }

    @Test
    void find_rejectsUndeclaredField() {
        assertThatThrownBy(() -> service.find("stocks", Map.of("color", "red"), 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported filter field: color");
    }

    @Test
    void find_rejectsUnparseableValue() {
        assertThatThrownBy(() -> service.find("stocks", Map.of("quantity", "many"), 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void find_rejectsLimitOutOfRange() {
        assertThatThrownBy(() -> service.find("stocks", Map.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.find("stocks", Map.of(), DocumentQueryService.MAX_LIMIT + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownCollection_isRejected() {
        assertThatThrownBy(() -> service.find("orders", Map.of(), 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown collection: orders");
        assertThatThrownBy(() -> service.findByProductCode("orders", "P-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

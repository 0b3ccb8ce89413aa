package com.poc.svc.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.svc.ingestion.dto.FailureReason;
import com.poc.svc.ingestion.dto.InboundMessage;
import com.poc.svc.ingestion.dto.IngestionRecord;
import com.poc.svc.ingestion.dto.ValidationResult;
import com.poc.svc.ingestion.schema.FieldSpec;
import com.poc.svc.ingestion.schema.SchemaContract;
import com.poc.svc.ingestion.schema.SchemaRegistry;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 依 {@link SchemaRegistry} 驗證訊息內容。純函式：不做 I/O、不記錄 log，相同輸入永遠得到相同結果。
 * <p>
 * 驗證順序：JSON 物件 → collection → product_code → schema 宣告欄位（依宣告順序，遇到第一個錯誤即停止）。
 * 未宣告的欄位一律忽略，不會造成拒絕，也不會被寫入。
 */
@Service
public class MessageValidator {

    public static final String COLLECTION_FIELD = "collection";
    public static final String PRODUCT_CODE_FIELD = "product_code";

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final SchemaRegistry schemaRegistry;
    private final ObjectMapper objectMapper;

    public MessageValidator(SchemaRegistry schemaRegistry, ObjectMapper objectMapper) {
        this.schemaRegistry = Objects.requireNonNull(schemaRegistry, "schemaRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public ValidationResult validate(InboundMessage message) {
        Objects.requireNonNull(message, "message must not be null");

        JsonNode root;
        try {
            root = objectMapper.readTree(message.body());
        } catch (JsonProcessingException ex) {
            return ValidationResult.invalid(FailureReason.MALFORMED_PAYLOAD, null, "Invalid JSON: " + ex.getOriginalMessage());
        } catch (IOException ex) {
            return ValidationResult.invalid(FailureReason.MALFORMED_PAYLOAD, null, "Unreadable body: " + ex.getMessage());
        }
        if (root == null || !root.isObject()) {
            return ValidationResult.invalid(FailureReason.MALFORMED_PAYLOAD, null, "Message must be a JSON object");
        }
        Map<String, Object> payload = objectMapper.convertValue(root, PAYLOAD_TYPE);

        if (!(payload.get(COLLECTION_FIELD) instanceof String collectionName)) {
            return ValidationResult.invalid(FailureReason.UNKNOWN_COLLECTION, COLLECTION_FIELD, "Missing collection field");
        }
        Optional<SchemaContract> resolved = schemaRegistry.resolve(collectionName);
        if (resolved.isEmpty()) {
            return ValidationResult.invalid(FailureReason.UNKNOWN_COLLECTION, COLLECTION_FIELD, "Unknown collection: " + collectionName);
        }
        SchemaContract contract = resolved.get();

        if (!(payload.get(PRODUCT_CODE_FIELD) instanceof String productCode) || productCode.isBlank()) {
            return ValidationResult.invalid(FailureReason.MISSING_IDENTIFIER, PRODUCT_CODE_FIELD, "Missing or empty product_code");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldSpec field : contract.fields()) {
            boolean present = payload.containsKey(field.name());
            Object value = payload.get(field.name());
            if (field.required()) {
                if (!present || value == null) {
                    return ValidationResult.invalid(FailureReason.SCHEMA_MISMATCH, field.name(), "Missing required field: " + field.name());
                }
            } else if (value == null) {
                if (field.hasDefault()) {
                    fields.put(field.name(), field.defaultValue());
                } else if (present) {
                    fields.put(field.name(), null);
                }
                continue;
            }
            if (!field.type().matches(value)) {
                return ValidationResult.invalid(
                        FailureReason.SCHEMA_MISMATCH,
                        field.name(),
                        "Invalid type for field %s: expected %s, got %s".formatted(field.name(), field.type(), field.type().describe(value)));
            }
            fields.put(field.name(), normalize(value));
        }

        IngestionRecord record = new IngestionRecord(
                contract.collection(),
                productCode,
                fields,
                message.receivedAt().truncatedTo(ChronoUnit.MILLIS)
        );
        return ValidationResult.valid(record);
    }

    private Object normalize(Object value) {
        // BSON 沒有 BigInteger codec
        if (value instanceof BigInteger bigInteger) {
            return new BigDecimal(bigInteger);
        }
        return value;
    }
}

package com.poc.svc.ingestion.schema;

import com.poc.svc.ingestion.dto.CollectionName;

import java.util.List;

import static com.poc.svc.ingestion.schema.FieldSpec.optional;
import static com.poc.svc.ingestion.schema.FieldSpec.required;

/**
 * products / stocks / prices 三種訊息的欄位定義。
 */
public final class DefaultSchemas {

    public static final SchemaContract PRODUCTS = SchemaContract.of(
            CollectionName.PRODUCTS,
            required("name", FieldType.STRING),
            optional("description", FieldType.STRING),
            optional("category", FieldType.STRING),
            optional("brand", FieldType.STRING),
            optional("sku", FieldType.STRING),
            optional("price", FieldType.NUMBER),
            optional("currency", FieldType.STRING, "USD"),
            optional("created_at", FieldType.STRING),
            optional("updated_at", FieldType.STRING)
    );

    public static final SchemaContract STOCKS = SchemaContract.of(
            CollectionName.STOCKS,
            required("warehouse_id", FieldType.STRING),
            required("quantity", FieldType.INTEGER),
            optional("location", FieldType.STRING),
            optional("updated_at", FieldType.STRING)
    );

    public static final SchemaContract PRICES = SchemaContract.of(
            CollectionName.PRICES,
            required("price", FieldType.NUMBER),
            required("currency", FieldType.STRING),
            optional("base_price", FieldType.NUMBER),
            optional("discount_percentage", FieldType.NUMBER, 0.0d),
            optional("final_price", FieldType.NUMBER),
            optional("effective_date", FieldType.STRING),
            optional("expires_at", FieldType.STRING),
            optional("promotion_id", FieldType.STRING)
    );

    private DefaultSchemas() {
    }

    public static SchemaRegistry registry() {
        return SchemaRegistry.of(List.of(PRODUCTS, STOCKS, PRICES));
    }
}

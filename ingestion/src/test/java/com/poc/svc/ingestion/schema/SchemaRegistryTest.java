package com.poc.svc.ingestion.schema;

import com.poc.svc.ingestion.dto.CollectionName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaRegistryTest {

    private final SchemaRegistry registry = DefaultSchemas.registry();

    @Test
    @DisplayName("resolves every supported collection by wire name")
    void resolve_knownCollections() {
        assertThat(registry.resolve("products")).contains(DefaultSchemas.PRODUCTS);
        assertThat(registry.resolve("stocks")).contains(DefaultSchemas.STOCKS);
        assertThat(registry.resolve("prices")).contains(DefaultSchemas.PRICES);
    }

    @Test
    @DisplayName("unknown or differently cased names are not found")
    void resolve_unknownCollection() {
        assertThat(registry.resolve("orders")).isEmpty();
        assertThat(registry.resolve("Products")).isEmpty();
        assertThat(registry.resolve((String) null)).isEmpty();
    }

    @Test
    void stocksContract_declaresRequiredFieldsInOrder() {
        SchemaContract stocks = registry.resolve(CollectionName.STOCKS).orElseThrow();

        assertThat(stocks.requiredFields())
                .extracting(FieldSpec::name)
                .containsExactly("warehouse_id", "quantity");
        assertThat(stocks.field("quantity")).get()
                .extracting(FieldSpec::type)
                .isEqualTo(FieldType.INTEGER);
        assertThat(stocks.declares("location")).isTrue();
        assertThat(stocks.declares("sku")).isFalse();
    }

    @Test
    void pricesContract_defaultsDiscountToZero() {
        FieldSpec discount = DefaultSchemas.PRICES.field("discount_percentage").orElseThrow();

        assertThat(discount.required()).isFalse();
        assertThat(discount.hasDefault()).isTrue();
        assertThat(discount.defaultValue()).isEqualTo(0.0d);
    }

    @Test
    void of_rejectsDuplicateCollections() {
        assertThatThrownBy(() -> SchemaRegistry.of(List.of(DefaultSchemas.PRODUCTS, DefaultSchemas.PRODUCTS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate schema");
    }

    @Test
    void contract_rejectsDuplicateFieldNames() {
        assertThatThrownBy(() -> SchemaContract.of(
                CollectionName.PRODUCTS,
                FieldSpec.required("name", FieldType.STRING),
                FieldSpec.optional("name", FieldType.STRING)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate field 'name'");
    }

    @Test
    void fieldType_parsesQueryValues() {
        assertThat(FieldType.INTEGER.parse("42")).isEqualTo(42L);
        assertThat(FieldType.NUMBER.parse("9.5")).isEqualTo(9.5d);
        assertThat(FieldType.BOOLEAN.parse("TRUE")).isEqualTo(Boolean.TRUE);
        assertThat(FieldType.STRING.parse("W1")).isEqualTo("W1");
        assertThatThrownBy(() -> FieldType.INTEGER.parse("many"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldType.BOOLEAN.parse("yes"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.poc.svc.ingestion.schema;

import com.poc.svc.ingestion.dto.CollectionName;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 單一 collection 的宣告式欄位清單，順序即為驗證順序。
 */
public record SchemaContract(CollectionName collection, List<FieldSpec> fields) {

    public SchemaContract {
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (FieldSpec field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("duplicate field '%s' in %s schema".formatted(field.name(), collection));
            }
        }
    }

    public static SchemaContract of(CollectionName collection, FieldSpec... fields) {
        return new SchemaContract(collection, List.of(fields));
    }

    public List<FieldSpec> requiredFields() {
        return fields.stream().filter(FieldSpec::required).toList();
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }

    public boolean declares(String name) {
        return field(name).isPresent();
    }
}

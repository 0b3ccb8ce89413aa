package com.poc.svc.ingestion.schema;

import com.poc.svc.ingestion.dto.CollectionName;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * collection 名稱對應 {@link SchemaContract}。建立後不可變，可由所有 consumer 共用。
 */
public final class SchemaRegistry {

    private final Map<CollectionName, SchemaContract> contracts;

    private SchemaRegistry(Map<CollectionName, SchemaContract> contracts) {
        this.contracts = contracts;
    }

    public static SchemaRegistry of(Collection<SchemaContract> contracts) {
        Objects.requireNonNull(contracts, "contracts must not be null");
        Map<CollectionName, SchemaContract> byCollection = new EnumMap<>(CollectionName.class);
        for (SchemaContract contract : contracts) {
            if (byCollection.putIfAbsent(contract.collection(), contract) != null) {
                throw new IllegalArgumentException("duplicate schema for collection " + contract.collection());
            }
        }
        return new SchemaRegistry(Map.copyOf(byCollection));
    }

    public Optional<SchemaContract> resolve(CollectionName collection) {
        return Optional.ofNullable(contracts.get(collection));
    }

    public Optional<SchemaContract> resolve(String collection) {
        return CollectionName.fromValue(collection).flatMap(this::resolve);
    }
}

package com.poc.svc.ingestion.dto;

import java.util.Arrays;
import java.util.Optional;

/**
 * 可接收的資料集合，名稱同時作為 MongoDB collection 名稱。
 */
public enum CollectionName {

    PRODUCTS("products"),
    STOCKS("stocks"),
    PRICES("prices");

    private final String value;

    CollectionName(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<CollectionName> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(candidate -> candidate.value.equals(value))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}

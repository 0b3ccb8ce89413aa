package com.poc.svc.ingestion.schema;

import java.util.Objects;

public record FieldSpec(String name, FieldType type, boolean required, Object defaultValue) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required field '%s' cannot declare a default".formatted(name));
        }
        if (defaultValue != null && !type.matches(defaultValue)) {
            throw new IllegalArgumentException("default for '%s' does not match %s".formatted(name, type));
        }
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, null);
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false, null);
    }

    public static FieldSpec optional(String name, FieldType type, Object defaultValue) {
        return new FieldSpec(name, type, false, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}

package com.poc.svc.ingestion.schema;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * JSON 原始型別。數值由 Jackson 解析為 Integer / Long / BigInteger / Double / BigDecimal。
 */
public enum FieldType {

    STRING {
        @Override
        public boolean matches(Object value) {
            return value instanceof String;
        }
    },
    INTEGER {
        @Override
        public boolean matches(Object value) {
            return value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof BigInteger;
        }
    },
    NUMBER {
        @Override
        public boolean matches(Object value) {
            return INTEGER.matches(value)
                    || value instanceof Double
                    || value instanceof Float
                    || value instanceof BigDecimal;
        }
    },
    BOOLEAN {
        @Override
        public boolean matches(Object value) {
            return value instanceof Boolean;
        }
    };

    public abstract boolean matches(Object value);

    /**
     * 將查詢參數字串轉為此型別的值，格式錯誤時拋出 {@link IllegalArgumentException}。
     */
    public Object parse(String raw) {
        return switch (this) {
            case STRING -> raw;
            case INTEGER -> Long.parseLong(raw.trim());
            case NUMBER -> Double.parseDouble(raw.trim());
            case BOOLEAN -> {
                if ("true".equalsIgnoreCase(raw.trim())) {
                    yield Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(raw.trim())) {
                    yield Boolean.FALSE;
                }
                throw new IllegalArgumentException("Invalid boolean value: " + raw);
            }
        };
    }

    public String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}

package com.poc.svc.ingestion.config;

import com.mongodb.ConnectionString;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * MongoDB 連線設定。未指定 database 時沿用 URI 內的 database，再退回 {@value #DEFAULT_DATABASE}。
 */
@Validated
@ConfigurationProperties(prefix = "spring.data.mongodb")
public record MongoSettingsProperties(
        @NotBlank(message = "spring.data.mongodb.uri is required")
        String uri,
        String database
) {

    static final String DEFAULT_DATABASE = "ingestion";

    public ConnectionString connectionString() {
        return new ConnectionString(uri);
    }

    public String resolvedDatabase() {
        if (StringUtils.hasText(database)) {
            return database;
        }
        String fromUri = connectionString().getDatabase();
        return StringUtils.hasText(fromUri) ? fromUri : DEFAULT_DATABASE;
    }
}

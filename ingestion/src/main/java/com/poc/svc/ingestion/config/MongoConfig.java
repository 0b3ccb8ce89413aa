package com.poc.svc.ingestion.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

import java.util.concurrent.TimeUnit;

/**
 * MongoClient 內建連線池為所有 consumer 共用的唯一可變資源，每次 driver 呼叫自行借還連線。
 */
@Configuration
@EnableConfigurationProperties({MongoSettingsProperties.class, IngestionProperties.class})
public class MongoConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoConfig.class);

    private final MongoSettingsProperties properties;
    private final IngestionProperties.Storage storage;

    public MongoConfig(MongoSettingsProperties properties, IngestionProperties ingestionProperties) {
        this.properties = properties;
        this.storage = ingestionProperties.getStorage();
    }

    @PostConstruct
    void validate() {
        ConnectionString connectionString = properties.connectionString(); // 解析錯誤時立即拋出例外
        log.info("MongoDB hosts={} database={} maxPoolSize={} socketReadTimeout={}ms",
                connectionString.getHosts(), properties.resolvedDatabase(), storage.getMaxPoolSize(),
                storage.effectiveSocketReadTimeout().toMillis());
    }

    @Bean
    public MongoClient mongoClient() {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(properties.connectionString())
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(storage.getMaxPoolSize())
                        .maxWaitTime(storage.getPoolMaxWait().toMillis(), TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(storage.getServerSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .readTimeout((int) storage.effectiveSocketReadTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(MongoClient mongoClient) {
        return new SimpleMongoClientDatabaseFactory(mongoClient, properties.resolvedDatabase());
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoDatabaseFactory factory) {
        return new MongoTemplate(factory);
    }
}

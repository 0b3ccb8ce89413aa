package com.poc.svc.ingestion.config;

import com.poc.svc.ingestion.schema.DefaultSchemas;
import com.poc.svc.ingestion.schema.SchemaRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchemaRegistryConfig {

    @Bean
    public SchemaRegistry schemaRegistry() {
        return DefaultSchemas.registry();
    }

    @Bean
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }
}

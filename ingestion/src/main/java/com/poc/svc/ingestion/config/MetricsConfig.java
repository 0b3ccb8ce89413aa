package com.poc.svc.ingestion.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    public static final String INGESTION_MESSAGES = "ingestion.messages";
    public static final String INGESTION_DEAD_LETTERS = "ingestion.dead_letters";
    public static final String STORE_WRITE_LATENCY = "ingestion.store.write.latency";

    public static final String OUTCOME_ACKNOWLEDGED = "acknowledged";
    public static final String OUTCOME_DEAD_LETTERED = "dead_lettered";
    public static final String OUTCOME_RETRIED = "retried";
    public static final String OUTCOME_REDELIVERY_PENDING = "redelivery_pending";

    @Bean
    public Timer storeWriteLatencyTimer(MeterRegistry registry) {
        return storeWriteTimer(registry);
    }

    public static Timer storeWriteTimer(MeterRegistry registry) {
        return Timer.builder(STORE_WRITE_LATENCY)
                .description("MongoDB upsert 單次嘗試耗時 (milliseconds)")
                .publishPercentileHistogram()
                .register(registry);
    }
}

package com.poc.svc.ingestion.health;

import com.poc.svc.ingestion.dto.ConsumerHealth;
import com.poc.svc.ingestion.service.consumer.ConsumerManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 任一 queue consumer 不健康時回報 DOWN；尚未啟動時為 UNKNOWN。
 */
@Component("ingestion")
public class IngestionHealthIndicator implements HealthIndicator {

    private final ConsumerManager consumerManager;

    public IngestionHealthIndicator(ConsumerManager consumerManager) {
        this.consumerManager = consumerManager;
    }

    @Override
    public Health health() {
        if (!consumerManager.isRunning()) {
            return Health.unknown().withDetail("running", false).build();
        }
        List<ConsumerHealth> consumers = consumerManager.health();
        Map<String, Object> details = new LinkedHashMap<>();
        consumers.forEach(consumer -> details.put(consumer.queue(), Map.of(
                "state", consumer.state(),
                "healthy", consumer.healthy(),
                "lastProgressAt", String.valueOf(consumer.lastProgressAt()))));
        boolean allHealthy = consumers.stream().allMatch(ConsumerHealth::healthy);
        Health.Builder builder = allHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }
}

package com.poc.svc.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 啟動時讀取一次的 ingestion 設定，之後視為不可變。
 */
@Validated
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    @NotEmpty(message = "ingestion.queues must list at least one queue")
    private List<@NotBlank String> queues = new ArrayList<>(List.of("products", "stocks", "prices"));

    @NotBlank
    private String deadLetterSuffix = ".dlq";

    @Valid
    private final Consumers consumers = new Consumers();

    @Valid
    private final Storage storage = new Storage();

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues;
    }

    public String getDeadLetterSuffix() {
        return deadLetterSuffix;
    }

    public void setDeadLetterSuffix(String deadLetterSuffix) {
        this.deadLetterSuffix = deadLetterSuffix;
    }

    public Consumers getConsumers() {
        return consumers;
    }

    public Storage getStorage() {
        return storage;
    }

    public String deadLetterQueueFor(String queue) {
        return queue + deadLetterSuffix;
    }

    public static class Consumers {

        private boolean autoStartup = true;

        @NotNull
        private Duration pollInterval = Duration.ofMillis(200);

        @NotNull
        private Duration watchdogInterval = Duration.ofSeconds(60);

        @NotNull
        private Duration drainTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration reconnectDelay = Duration.ofSeconds(5);

        @NotNull
        private Duration maxReconnectDelay = Duration.ofSeconds(60);

        public boolean isAutoStartup() {
            return autoStartup;
        }

        public void setAutoStartup(boolean autoStartup) {
            this.autoStartup = autoStartup;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getWatchdogInterval() {
            return watchdogInterval;
        }

        public void setWatchdogInterval(Duration watchdogInterval) {
            this.watchdogInterval = watchdogInterval;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public Duration getReconnectDelay() {
            return reconnectDelay;
        }

        public void setReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
        }

        public Duration getMaxReconnectDelay() {
            return maxReconnectDelay;
        }

        public void setMaxReconnectDelay(Duration maxReconnectDelay) {
            this.maxReconnectDelay = maxReconnectDelay;
        }
    }

    public static class Storage {

        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(5);

        @Min(value = 1, message = "ingestion.storage.write-threads must be >= 1")
        private int writeThreads = 4;

        @Min(value = 1, message = "ingestion.storage.max-pool-size must be >= 1")
        private int maxPoolSize = 20;

        @NotNull
        private Duration poolMaxWait = Duration.ofSeconds(2);

        @NotNull
        private Duration serverSelectionTimeout = Duration.ofSeconds(3);

        @NotNull
        private Duration socketReadTimeout = Duration.ofSeconds(5);

        public Duration getWriteTimeout() {
            return writeTimeout;
        }

        public void setWriteTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
        }

        public int getWriteThreads() {
            return writeThreads;
        }

        public void setWriteThreads(int writeThreads) {
            this.writeThreads = writeThreads;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public Duration getPoolMaxWait() {
            return poolMaxWait;
        }

        public void setPoolMaxWait(Duration poolMaxWait) {
            this.poolMaxWait = poolMaxWait;
        }

        public Duration getServerSelectionTimeout() {
            return serverSelectionTimeout;
        }

        public void setServerSelectionTimeout(Duration serverSelectionTimeout) {
            this.serverSelectionTimeout = serverSelectionTimeout;
        }

        public Duration getSocketReadTimeout() {
            return socketReadTimeout;
        }

        public void setSocketReadTimeout(Duration socketReadTimeout) {
            this.socketReadTimeout = socketReadTimeout;
        }

        /**
         * 實際套用到 driver 的 socket read timeout，不超過 write-timeout，
         * 已送出的寫入因此最多比 write-timeout 晚一個 socket timeout 結束。
         */
        public Duration effectiveSocketReadTimeout() {
            return socketReadTimeout.compareTo(writeTimeout) <= 0 ? socketReadTimeout : writeTimeout;
        }
    }
}

package com.poc.svc.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class StorageExecutorConfig {

    public static final String STORE_WRITE_EXECUTOR = "storeWriteExecutor";

    @Bean(name = STORE_WRITE_EXECUTOR)
    public Executor storeWriteExecutor(IngestionProperties properties) {
        ThreadPoolTaskExecutor taskExecutor = new ThreadPoolTaskExecutor();
        int poolSize = properties.getStorage().getWriteThreads();
        taskExecutor.setCorePoolSize(poolSize);
        taskExecutor.setMaxPoolSize(poolSize);
        // 每個 consumer 同時只有一筆寫入，佇列只容納逾時後仍在執行的寫入
        taskExecutor.setQueueCapacity(poolSize * 2 + properties.getQueues().size());
        taskExecutor.setThreadNamePrefix("store-write-");
        taskExecutor.setAllowCoreThreadTimeOut(true);
        taskExecutor.setWaitForTasksToCompleteOnShutdown(true);
        taskExecutor.setAwaitTerminationSeconds((int) properties.getStorage().getWriteTimeout().toSeconds() + 1);
        taskExecutor.initialize();
        return taskExecutor;
    }
}

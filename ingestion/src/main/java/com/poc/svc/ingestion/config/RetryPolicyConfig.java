package com.poc.svc.ingestion.config;

import com.poc.svc.ingestion.service.policy.RetryDeadLetterPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RetryPolicyProperties.class)
public class RetryPolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicyConfig.class);

    @Bean
    public RetryDeadLetterPolicy retryDeadLetterPolicy(RetryPolicyProperties properties) {
        log.info("Retry policy maxRetries={} initialBackoff={}ms multiplier={} maxBackoff={}ms",
                properties.getMaxRetries(),
                properties.getInitialBackoff().toMillis(),
                properties.getMultiplier(),
                properties.getMaxBackoff().toMillis());
        return new RetryDeadLetterPolicy(properties);
    }
}

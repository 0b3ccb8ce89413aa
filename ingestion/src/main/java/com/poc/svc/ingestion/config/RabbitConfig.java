package com.poc.svc.ingestion.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 宣告來源 queue 與對應的 dead-letter queue，皆為 durable。RabbitAdmin 於建立連線時套用。
 */
@Configuration
public class RabbitConfig {

    private static final Logger log = LoggerFactory.getLogger(RabbitConfig.class);

    @Bean
    public Declarables ingestionQueues(IngestionProperties properties) {
        List<Declarable> declarables = new ArrayList<>();
        for (String queue : properties.getQueues()) {
            declarables.add(QueueBuilder.durable(queue).build());
            declarables.add(QueueBuilder.durable(properties.deadLetterQueueFor(queue)).build());
        }
        log.info("Declaring ingestion queues {} with dead-letter suffix '{}'",
                properties.getQueues(), properties.getDeadLetterSuffix());
        return new Declarables(declarables);
    }
}

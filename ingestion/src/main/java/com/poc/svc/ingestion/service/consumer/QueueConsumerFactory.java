package com.poc.svc.ingestion.service.consumer;

import com.poc.svc.ingestion.broker.BrokerGateway;
import com.poc.svc.ingestion.broker.DeadLetterPublisher;
import com.poc.svc.ingestion.config.IngestionProperties;
import com.poc.svc.ingestion.service.MessageValidator;
import com.poc.svc.ingestion.service.StorageWriter;
import com.poc.svc.ingestion.service.policy.RetryDeadLetterPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 為每個 queue 組出一個新的 {@link QueueConsumer}。Validator、Writer 與 Policy 皆為共用的無狀態元件。
 */
@Component
public class QueueConsumerFactory {

    private final IngestionProperties properties;
    private final BrokerGateway brokerGateway;
    private final MessageValidator validator;
    private final StorageWriter storageWriter;
    private final RetryDeadLetterPolicy policy;
    private final DeadLetterPublisher deadLetterPublisher;
    private final BackoffSleeper sleeper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public QueueConsumerFactory(IngestionProperties properties,
                                BrokerGateway brokerGateway,
                                MessageValidator validator,
                                StorageWriter storageWriter,
                                RetryDeadLetterPolicy policy,
                                DeadLetterPublisher deadLetterPublisher,
                                Clock ingestionClock,
                                MeterRegistry meterRegistry) {
        this(properties, brokerGateway, validator, storageWriter, policy, deadLetterPublisher,
                BackoffSleeper.stopAware(), ingestionClock, meterRegistry);
    }

    public QueueConsumerFactory(IngestionProperties properties,
                                BrokerGateway brokerGateway,
                                MessageValidator validator,
                                StorageWriter storageWriter,
                                RetryDeadLetterPolicy policy,
                                DeadLetterPublisher deadLetterPublisher,
                                BackoffSleeper sleeper,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.properties = properties;
        this.brokerGateway = brokerGateway;
        this.validator = validator;
        this.storageWriter = storageWriter;
        this.policy = policy;
        this.deadLetterPublisher = deadLetterPublisher;
        this.sleeper = sleeper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public QueueConsumer create(String queue) {
        IngestionProperties.Consumers consumers = properties.getConsumers();
        QueueConsumer.Settings settings = new QueueConsumer.Settings(
                consumers.getPollInterval(),
                consumers.getReconnectDelay(),
                consumers.getMaxReconnectDelay(),
                properties.deadLetterQueueFor(queue));
        return new QueueConsumer(queue, brokerGateway, validator, storageWriter, policy,
                deadLetterPublisher, sleeper, settings, clock, meterRegistry);
    }
}

package com.poc.svc.ingestion.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.poc.svc.ingestion.dto.DeadLetter;
import com.poc.svc.ingestion.exception.BrokerAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 透過 default exchange 將 dead letter 以 persistent JSON 寫入 {@code <queue>.dlq}。
 * 啟用 simple publisher confirms 時會等待 broker 確認後才回傳。
 */
@Component
public class RabbitDeadLetterPublisher implements DeadLetterPublisher {

    private static final Logger log = LoggerFactory.getLogger(RabbitDeadLetterPublisher.class);
    private static final String DEFAULT_EXCHANGE = "";
    private static final Duration CONFIRM_TIMEOUT = Duration.ofSeconds(5);

    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    public RabbitDeadLetterPublisher(RabbitTemplate rabbitTemplate, ObjectMapper objectMapper) {
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String deadLetterQueue, DeadLetter deadLetter) {
        Message message = toMessage(deadLetter);
        try {
            if (rabbitTemplate.getConnectionFactory().isSimplePublisherConfirms()) {
                rabbitTemplate.invoke(operations -> {
                    operations.send(DEFAULT_EXCHANGE, deadLetterQueue, message);
                    operations.waitForConfirmsOrDie(CONFIRM_TIMEOUT.toMillis());
                    return Boolean.TRUE;
                });
            } else {
                rabbitTemplate.send(DEFAULT_EXCHANGE, deadLetterQueue, message);
            }
        } catch (AmqpException ex) {
            throw new BrokerAccessException("Failed to publish dead letter to " + deadLetterQueue, ex);
        }
        log.debug("Published dead letter to {} messageId={}", deadLetterQueue, deadLetter.messageId());
    }

    private Message toMessage(DeadLetter deadLetter) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(deadLetter);
        } catch (JsonProcessingException ex) {
            throw new BrokerAccessException("Failed to serialize dead letter", ex);
        }
        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setContentEncoding("UTF-8");
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(deadLetter.messageId());
        properties.setHeader("x-failure-reason", deadLetter.failureReason());
        return new Message(payload, properties);
    }
}

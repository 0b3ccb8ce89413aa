package com.poc.svc.ingestion.broker;

import com.poc.svc.ingestion.dto.InboundMessage;
import com.poc.svc.ingestion.exception.BrokerAccessException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * 以 basic.get 拉取訊息、手動 ack 的 RabbitMQ adapter。每個 session 持有自己的 channel。
 */
@Component
public class RabbitBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerGateway.class);

    static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final ConnectionFactory connectionFactory;
    private final Clock clock;

    public RabbitBrokerGateway(ConnectionFactory connectionFactory, Clock ingestionClock) {
        this.connectionFactory = connectionFactory;
        this.clock = ingestionClock;
    }

    @Override
    public QueueSession open(String queue) {
        try {
            Connection connection = connectionFactory.createConnection();
            Channel channel = connection.createChannel(false);
            log.info("Opened broker channel queue={} channel={}", queue, channel.getChannelNumber());
            return new RabbitQueueSession(queue, channel);
        } catch (AmqpException ex) {
            throw new BrokerAccessException("Unable to open channel for queue " + queue, ex);
        }
    }

    static int deliveryCount(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        Object value = headers.get(DELIVERY_COUNT_HEADER);
        if (value instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (value != null) {
            try {
                return Math.max(0, Integer.parseInt(value.toString()));
            } catch (NumberFormatException ex) {
                log.warn("Ignoring non-numeric {} header value={}", DELIVERY_COUNT_HEADER, value);
            }
        }
        return 0;
    }

    static String messageId(String candidate, byte[] body) {
        if (StringUtils.hasText(candidate)) {
            return candidate;
        }
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private final class RabbitQueueSession implements QueueSession {

        private final String queue;
        private final Channel channel;

        private RabbitQueueSession(String queue, Channel channel) {
            this.queue = queue;
            this.channel = channel;
        }

        @Override
        public String queue() {
            return queue;
        }

        @Override
        public Optional<InboundMessage> poll() {
            GetResponse response;
            try {
                response = channel.basicGet(queue, false);
            } catch (IOException | AmqpException | ShutdownSignalException ex) {
                throw new BrokerAccessException("basic.get failed on queue " + queue, ex);
            }
            if (response == null) {
                return Optional.empty();
            }
            AMQP.BasicProperties properties = response.getProps();
            byte[] body = response.getBody() != null ? response.getBody() : "".getBytes(StandardCharsets.UTF_8);
            Instant receivedAt = properties != null && properties.getTimestamp() != null
                    ? properties.getTimestamp().toInstant()
                    : clock.instant();
            return Optional.of(new InboundMessage(
                    queue,
                    response.getEnvelope().getDeliveryTag(),
                    messageId(properties != null ? properties.getMessageId() : null, body),
                    deliveryCount(properties != null ? properties.getHeaders() : null),
                    response.getEnvelope().isRedeliver(),
                    body,
                    receivedAt
            ));
        }

        @Override
        public void ack(InboundMessage message) {
            try {
                channel.basicAck(message.deliveryTag(), false);
            } catch (IOException | AmqpException | ShutdownSignalException ex) {
                throw new BrokerAccessException("basic.ack failed on queue " + queue, ex);
            }
        }

        @Override
        public void requeue(InboundMessage message) {
            try {
                channel.basicNack(message.deliveryTag(), false, true);
            } catch (IOException | AmqpException | ShutdownSignalException ex) {
                throw new BrokerAccessException("basic.nack failed on queue " + queue, ex);
            }
        }

        @Override
        public void recover() {
            try {
                channel.basicRecover(true);
            } catch (IOException | AmqpException | ShutdownSignalException ex) {
                throw new BrokerAccessException("basic.recover failed on queue " + queue, ex);
            }
        }

        @Override
        public boolean isOpen() {
            return channel.isOpen();
        }

        @Override
        public void close() {
            if (!channel.isOpen()) {
                return;
            }
            try {
                channel.close();
            } catch (IOException | TimeoutException | AmqpException | ShutdownSignalException ex) {
                log.warn("Error closing channel for queue {}: {}", queue, ex.getMessage());
            }
        }
    }
}

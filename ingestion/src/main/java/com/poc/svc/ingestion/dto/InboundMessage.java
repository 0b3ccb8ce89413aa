package com.poc.svc.ingestion.dto;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * 從 broker 取得、尚未 ack 的原始訊息與其 metadata。
 */
public record InboundMessage(
        String queue,
        long deliveryTag,
        String messageId,
        int redeliveryCount,
        boolean redelivered,
        byte[] body,
        Instant receivedAt
) {

    public InboundMessage {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(messageId, "messageId must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        if (redeliveryCount < 0) {
            throw new IllegalArgumentException("redeliveryCount must be >= 0");
        }
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "InboundMessage[queue=%s, deliveryTag=%d, messageId=%s, redeliveryCount=%d]"
                .formatted(queue, deliveryTag, messageId, redeliveryCount);
    }
}

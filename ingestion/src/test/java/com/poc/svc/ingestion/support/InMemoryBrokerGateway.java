package com.poc.svc.ingestion.support;

import com.poc.svc.ingestion.broker.BrokerGateway;
import com.poc.svc.ingestion.broker.QueueSession;
import com.poc.svc.ingestion.dto.InboundMessage;
import com.poc.svc.ingestion.exception.BrokerAccessException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 以記憶體模擬 RabbitMQ queue：poll 取出 head 成為 unacked，requeue 放回 head，recover 依序放回所有 unacked。
 * {@code countDeliveries} 為 true 時模擬 quorum queue 的 x-delivery-count。
 */
public class InMemoryBrokerGateway implements BrokerGateway {

    private final Map<String, Deque<InboundMessage>> queues = new HashMap<>();
    private final Map<Long, InboundMessage> unacked = new LinkedHashMap<>();
    private final List<InboundMessage> acked = new ArrayList<>();
    private final List<InboundMessage> requeued = new ArrayList<>();
    private final AtomicLong deliveryTags = new AtomicLong();
    private final AtomicInteger pollFailures = new AtomicInteger();
    private final AtomicInteger sessionsOpened = new AtomicInteger();
    private final boolean countDeliveries;
    private int recoveries;

    public InMemoryBrokerGateway() {
        this(false);
    }

    public InMemoryBrokerGateway(boolean countDeliveries) {
        this.countDeliveries = countDeliveries;
    }

    public synchronized void publish(String queue, String messageId, String json) {
        queues.computeIfAbsent(queue, ignored -> new ArrayDeque<>()).addLast(new InboundMessage(
                queue, 0L, messageId, 0, false, json.getBytes(StandardCharsets.UTF_8), Instant.parse("2025-01-01T00:00:00Z")));
    }

    /**
     * 直接取出下一則訊息（等同一次 poll），供不啟動 consumer thread 的測試使用。
     */
    public synchronized Optional<InboundMessage> deliver(String queue) {
        Deque<InboundMessage> pending = queues.get(queue);
        if (pending == null || pending.isEmpty()) {
            return Optional.empty();
        }
        InboundMessage next = pending.pollFirst();
        InboundMessage delivered = new InboundMessage(
                next.queue(),
                deliveryTags.incrementAndGet(),
                next.messageId(),
                next.redeliveryCount(),
                next.redelivered(),
                next.body(),
                next.receivedAt());
        unacked.put(delivered.deliveryTag(), delivered);
        return Optional.of(delivered);
    }

    public void failNextPolls(int count) {
        pollFailures.set(count);
    }

    public synchronized int pending(String queue) {
        Deque<InboundMessage> pending = queues.get(queue);
        return pending == null ? 0 : pending.size();
    }

    public synchronized List<InboundMessage> pendingMessages(String queue) {
        Deque<InboundMessage> pending = queues.get(queue);
        return pending == null ? List.of() : List.copyOf(pending);
    }

    public synchronized int unackedCount() {
        return unacked.size();
    }

    public synchronized List<InboundMessage> acked() {
        return List.copyOf(acked);
    }

    public synchronized List<String> ackedMessageIds() {
        return acked.stream().map(InboundMessage::messageId).toList();
    }

    public synchronized List<InboundMessage> requeued() {
        return List.copyOf(requeued);
    }

    public synchronized int recoveries() {
        return recoveries;
    }

    public int sessionsOpened() {
        return sessionsOpened.get();
    }

    @Override
    public QueueSession open(String queue) {
        sessionsOpened.incrementAndGet();
        return new InMemorySession(queue);
    }

    private synchronized void ack(InboundMessage message) {
        InboundMessage removed = unacked.remove(message.deliveryTag());
        if (removed == null) {
            throw new BrokerAccessException("Unknown delivery tag " + message.deliveryTag());
        }
        acked.add(removed);
    }

    private synchronized void requeue(InboundMessage message) {
        InboundMessage removed = unacked.remove(message.deliveryTag());
        if (removed == null) {
            throw new BrokerAccessException("Unknown delivery tag " + message.deliveryTag());
        }
        requeued.add(removed);
        queues.get(removed.queue()).addFirst(redelivery(removed));
    }

    private synchronized void recover(String queue) {
        recoveries++;
        List<InboundMessage> toReturn = unacked.values().stream()
                .filter(message -> message.queue().equals(queue))
                .toList();
        for (int i = toReturn.size() - 1; i >= 0; i--) {
            InboundMessage message = toReturn.get(i);
            unacked.remove(message.deliveryTag());
            queues.get(queue).addFirst(redelivery(message));
        }
    }

    private InboundMessage redelivery(InboundMessage message) {
        return new InboundMessage(
                message.queue(),
                0L,
                message.messageId(),
                countDeliveries ? message.redeliveryCount() + 1 : message.redeliveryCount(),
                true,
                message.body(),
                message.receivedAt());
    }

    private final class InMemorySession implements QueueSession {

        private final String queue;
        private boolean open = true;

        private InMemorySession(String queue) {
            this.queue = queue;
        }

        @Override
        public String queue() {
            return queue;
        }

        @Override
        public Optional<InboundMessage> poll() {
            if (pollFailures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
                open = false;
                throw new BrokerAccessException("simulated connection loss");
            }
            return deliver(queue);
        }

        @Override
        public void ack(InboundMessage message) {
            InMemoryBrokerGateway.this.ack(message);
        }

        @Override
        public void requeue(InboundMessage message) {
            InMemoryBrokerGateway.this.requeue(message);
        }

        @Override
        public void recover() {
            InMemoryBrokerGateway.this.recover(queue);
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}

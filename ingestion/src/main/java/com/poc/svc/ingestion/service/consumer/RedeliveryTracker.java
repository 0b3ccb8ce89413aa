package com.poc.svc.ingestion.service.consumer;

import com.poc.svc.ingestion.dto.InboundMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 記錄本 consumer 已排程重試的次數，補足 classic queue 沒有 x-delivery-count header 的情況。
 * 僅由單一 consumer thread 存取。
 */
public class RedeliveryTracker {

    static final int DEFAULT_CAPACITY = 10_000;

    private final Map<String, Integer> retries;

    public RedeliveryTracker() {
        this(DEFAULT_CAPACITY);
    }

    public RedeliveryTracker(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.retries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * @return 此次 delivery 的嘗試序號，首次為 0
     */
    public int attemptIndex(InboundMessage message) {
        return Math.max(message.redeliveryCount(), retries.getOrDefault(message.messageId(), 0));
    }

    public void recordRetry(String messageId, int retryIndex) {
        retries.put(messageId, retryIndex + 1);
    }

    public void forget(String messageId) {
        retries.remove(messageId);
    }

    public int size() {
        return retries.size();
    }
}

package com.poc.svc.ingestion.service.consumer;

import com.poc.svc.ingestion.dto.InboundMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RedeliveryTrackerTest {

    @Test
    void attemptIndex_takesLargerOfHeaderAndLocalCount() {
        RedeliveryTracker tracker = new RedeliveryTracker();

        assertThat(tracker.attemptIndex(message("m-1", 0))).isZero();
        tracker.recordRetry("m-1", 0);
        assertThat(tracker.attemptIndex(message("m-1", 0))).isEqualTo(1);
        assertThat(tracker.attemptIndex(message("m-1", 1))).isEqualTo(1);
        assertThat(tracker.attemptIndex(message("m-1", 3))).isEqualTo(3);
    }

    @Test
    void forget_resetsCount() {
        RedeliveryTracker tracker = new RedeliveryTracker();
        tracker.recordRetry("m-1", 2);

        tracker.forget("m-1");

        assertThat(tracker.attemptIndex(message("m-1", 0))).isZero();
        assertThat(tracker.size()).isZero();
    }

    @Test
    void evictsLeastRecentlyUsedBeyondCapacity() {
        RedeliveryTracker tracker = new RedeliveryTracker(2);
        tracker.recordRetry("m-1", 0);
        tracker.recordRetry("m-2", 0);
        tracker.recordRetry("m-3", 0);

        assertThat(tracker.size()).isEqualTo(2);
        assertThat(tracker.attemptIndex(message("m-1", 0))).isZero();
        assertThat(tracker.attemptIndex(message("m-3", 0))).isEqualTo(1);
    }

    private InboundMessage message(String messageId, int redeliveryCount) {
        return new InboundMessage("products", 1L, messageId, redeliveryCount, redeliveryCount > 0,
                "{}".getBytes(StandardCharsets.UTF_8), Instant.parse("2025-01-01T00:00:00Z"));
    }
}

package com.poc.svc.ingestion.support;

import com.poc.svc.ingestion.broker.DeadLetterPublisher;
import com.poc.svc.ingestion.dto.DeadLetter;
import com.poc.svc.ingestion.exception.BrokerAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class RecordingDeadLetterPublisher implements DeadLetterPublisher {

    public record Published(String queue, DeadLetter deadLetter) {
    }

    private final List<Published> published = new ArrayList<>();
    private final AtomicBoolean failing = new AtomicBoolean();

    public void failPublishing(boolean fail) {
        failing.set(fail);
    }

    @Override
    public synchronized void publish(String deadLetterQueue, DeadLetter deadLetter) {
        if (failing.get()) {
            throw new BrokerAccessException("simulated DLQ publish failure");
        }
        published.add(new Published(deadLetterQueue, deadLetter));
    }

    public synchronized List<Published> published() {
        return List.copyOf(published);
    }
}

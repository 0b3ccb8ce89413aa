package com.poc.svc.ingestion.service.policy;

import java.util.ArrayList;
import java.util.List;

/**
 * 單一 delivery 的狀態追蹤，只允許 {@link DeliveryState#successors()} 定義的轉移。
 */
public final class DeliveryStateMachine {

    private final List<DeliveryState> history = new ArrayList<>();
    private DeliveryState current;

    public DeliveryStateMachine() {
        this.current = DeliveryState.RECEIVED;
        history.add(DeliveryState.RECEIVED);
    }

    public DeliveryState current() {
        return current;
    }

    public DeliveryStateMachine transitionTo(DeliveryState next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal delivery transition %s -> %s".formatted(current, next));
        }
        current = next;
        history.add(next);
        return this;
    }

    public boolean isFinal() {
        return current.isFinal();
    }

    public List<DeliveryState> history() {
        return List.copyOf(history);
    }
}

package com.poc.svc.ingestion.service.policy;

import java.util.EnumSet;
import java.util.Set;

public enum DeliveryState {

    RECEIVED,
    VALIDATING,
    PERSISTING,
    REJECTED,
    RETRY_SCHEDULED,
    ACKNOWLEDGED,
    DEAD_LETTERED;

    public Set<DeliveryState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(PERSISTING, REJECTED);
            case PERSISTING -> EnumSet.of(ACKNOWLEDGED, RETRY_SCHEDULED, DEAD_LETTERED);
            case REJECTED -> EnumSet.of(DEAD_LETTERED);
            case RETRY_SCHEDULED, ACKNOWLEDGED, DEAD_LETTERED -> EnumSet.noneOf(DeliveryState.class);
        };
    }

    public boolean canTransitionTo(DeliveryState next) {
        return successors().contains(next);
    }

    /**
     * 此 delivery 已結束。RETRY_SCHEDULED 會在 requeue 後以新的 delivery 重新開始。
     */
    public boolean isFinal() {
        return successors().isEmpty();
    }
}

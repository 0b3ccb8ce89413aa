package com.poc.svc.ingestion.service.consumer;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {

    /**
     * 等待重試延遲，收到停止訊號時提前返回。
     *
     * @return 完整等待了 {@code delay} 時回傳 true
     */
    boolean sleep(Duration delay, StopSignal stopSignal) throws InterruptedException;

    static BackoffSleeper stopAware() {
        return (delay, stopSignal) -> !stopSignal.await(delay);
    }
}

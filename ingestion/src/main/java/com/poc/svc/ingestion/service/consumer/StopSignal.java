package com.poc.svc.ingestion.service.consumer;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 一次性的停止訊號。所有可中斷的等待都以此為喚醒來源。
 */
public final class StopSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void raise() {
        latch.countDown();
    }

    public boolean isRaised() {
        return latch.getCount() == 0;
    }

    /**
     * @return 等待期間收到停止訊號時回傳 true
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isRaised();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}

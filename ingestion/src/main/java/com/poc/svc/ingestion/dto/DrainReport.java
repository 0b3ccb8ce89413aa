package com.poc.svc.ingestion.dto;

import java.time.Duration;
import java.util.List;

/**
 * drainAndStop 的結果：在期限內正常結束的 queue 與被強制中斷的 queue。
 */
public record DrainReport(List<String> stopped, List<String> cancelled, Duration elapsed) {

    public DrainReport {
        stopped = List.copyOf(stopped);
        cancelled = List.copyOf(cancelled);
    }

    public boolean isClean() {
        return cancelled.isEmpty();
    }
}

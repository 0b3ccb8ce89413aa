package com.poc.svc.ingestion.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "ConsumerHealth", description = "單一 queue consumer 的執行狀態")
public record ConsumerHealth(
        @Schema(description = "Queue 名稱", example = "products") String queue,
        @Schema(description = "Consumer 狀態", example = "RUNNING") String state,
        @Schema(description = "Loop 存活且於 watchdog 間隔內有進度") boolean healthy,
        @Schema(description = "Consumer thread 是否存活") boolean alive,
        @Schema(description = "最後一次進度時間") Instant lastProgressAt,
        @Schema(description = "已處理訊息數") long processed,
        @Schema(description = "已 ack 訊息數") long acknowledged,
        @Schema(description = "已送往 DLQ 訊息數") long deadLettered,
        @Schema(description = "已排程重試次數") long retried,
        @Schema(description = "未 ack、等待 broker 重送的次數") long redeliveryPending
) {
}

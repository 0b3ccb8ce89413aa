package com.poc.svc.ingestion.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * 標準化錯誤回應結構。`details` 預設為不可變的空集合。
 */
@Schema(name = "ErrorResponse", description = "查詢 API 的錯誤回應格式")
public record ErrorResponse(
        @Schema(description = "錯誤代碼", example = "DOCUMENT_NOT_FOUND") String code,
        @Schema(description = "錯誤訊息", example = "Document not found: products/P-1") String message,
        @Schema(description = "額外錯誤細節", example = "{\"collection\":\"products\"}") Map<String, Object> details,
        @Schema(description = "Trace ID", example = "trace-1234") String traceId
) {

    public ErrorResponse {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ErrorResponse of(String code, String message, Map<String, Object> details, String traceId) {
        return new ErrorResponse(code, message, details, traceId);
    }
}

package com.poc.svc.ingestion.util;

import org.slf4j.MDC;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * 管理 log MDC 的 traceId、queue 與 productCode。
 * HTTP 請求以 X-Trace-Id 為 traceId；consumer 以訊息的 messageId 為 traceId，queue 綁定於整條 consumer thread。
 */
public final class TraceContext {

    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String TRACE_ID_MDC_KEY = "traceId";
    public static final String QUEUE_MDC_KEY = "queue";
    public static final String PRODUCT_CODE_MDC_KEY = "productCode";

    private TraceContext() {
    }

    /**
     * @return 沿用的 header 值，或新產生的 UUID
     */
    public static String bindRequest(String traceIdHeader) {
        String traceId = StringUtils.hasText(traceIdHeader) ? traceIdHeader : UUID.randomUUID().toString();
        put(TRACE_ID_MDC_KEY, traceId);
        return traceId;
    }

    public static void bindQueue(String queue) {
        put(QUEUE_MDC_KEY, queue);
    }

    public static void bindMessage(String messageId) {
        put(TRACE_ID_MDC_KEY, messageId);
    }

    public static void bindProductCode(String productCode) {
        put(PRODUCT_CODE_MDC_KEY, productCode);
    }

    public static String traceId() {
        return MDC.get(TRACE_ID_MDC_KEY);
    }

    /**
     * 訊息處理完畢後呼叫，queue 保留給下一則訊息。
     */
    public static void unbindMessage() {
        MDC.remove(TRACE_ID_MDC_KEY);
        MDC.remove(PRODUCT_CODE_MDC_KEY);
    }

    public static void clear() {
        unbindMessage();
        MDC.remove(QUEUE_MDC_KEY);
    }

    private static void put(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        }
    }
}

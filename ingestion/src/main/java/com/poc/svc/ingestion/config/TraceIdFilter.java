package com.poc.svc.ingestion.config;

import com.poc.svc.ingestion.util.TraceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 查詢 API 的 traceId 綁定與存取記錄。
 * 外部傳入的 X-Trace-Id 僅在格式合法時沿用，否則另產生新的；actuator 探測不經過此 filter。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final String ACTUATOR_PREFIX = "/actuator";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith(request.getContextPath() + ACTUATOR_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = TraceContext.bindRequest(acceptedTraceId(request.getHeader(TraceContext.TRACE_ID_HEADER)));
        response.setHeader(TraceContext.TRACE_ID_HEADER, traceId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} status={} elapsedMs={}", request.getMethod(), request.getRequestURI(), response.getStatus(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            TraceContext.clear();
        }
    }

    static String acceptedTraceId(String header) {
        if (header == null) {
            return null;
        }
        String trimmed = header.trim();
        if (ACCEPTED_TRACE_ID.matcher(trimmed).matches()) {
            return trimmed;
        }
        log.debug("Ignoring malformed {} header", TraceContext.TRACE_ID_HEADER);
        return null;
    }
}

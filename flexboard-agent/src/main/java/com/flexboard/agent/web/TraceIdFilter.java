package com.flexboard.agent.web;

import com.flexboard.agent.service.QueryDispatcher;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a trace id, taken from {@code X-Request-Id} when the proxy supplied a
 * usable one, and exposes it in MDC and on the response.
 *
 * <p>When the caller names a tenant ({@code X-Tenant-Id} header or {@code tenantId} parameter)
 * it is tagged too, so controller and web-layer log lines carry it before the dispatcher has
 * resolved the request. Every engine MDC key is cleared when the request ends; servlet threads
 * are pooled.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String TENANT_PARAM = "tenantId";
    public static final String MDC_TRACE_ID = "trace_id";

    // header values end up in log lines
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (request instanceof HttpServletRequest httpServletRequest) {
            String traceId = httpServletRequest.getHeader(TRACE_ID_HEADER);
            if (!isSafe(traceId)) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId);
            if (response instanceof HttpServletResponse httpServletResponse) {
                httpServletResponse.setHeader(TRACE_ID_HEADER, traceId);
            }

            String tenantId = httpServletRequest.getHeader(TENANT_HEADER);
            if (tenantId == null) {
                tenantId = httpServletRequest.getParameter(TENANT_PARAM);
            }
            if (isSafe(tenantId)) {
                MDC.put(QueryDispatcher.MDC_TENANT, tenantId);
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(QueryDispatcher.MDC_TENANT);
            MDC.remove(QueryDispatcher.MDC_DATA_SOURCE);
        }
    }

    private static boolean isSafe(String value) {
        return value != null && SAFE_ID.matcher(value).matches();
    }
}

package com.securenotify.keysvc.api.filter;

import com.securenotify.keysvc.shared.security.SecurityUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds a correlation id to each request. The id is echoed in {@code X-Correlation-ID},
 * copied into every log line through the MDC and returned in problem responses.
 * Runs first so rate limit rejections and authentication failures carry it too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final SecurityUtils securityUtils;

    public CorrelationIdFilter(SecurityUtils securityUtils) {
        this.securityUtils = securityUtils;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = securityUtils.getOrCreateCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        securityUtils.setMdcContext(correlationId, null);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        long startNanos = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), (System.nanoTime() - startNanos) / 1_000_000);
            }
            securityUtils.clearMdcContext();
        }
    }

}

package com.securenotify.keysvc.api.interceptor;

import com.securenotify.keysvc.domain.ratelimit.EndpointClass;
import com.securenotify.keysvc.domain.ratelimit.RateLimitDecision;
import com.securenotify.keysvc.domain.ratelimit.RateLimitService;
import com.securenotify.keysvc.shared.exception.RateLimitedException;
import com.securenotify.keysvc.shared.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Duration;

/**
 * Admits or rejects each API request by client IP and endpoint class.
 * Rate limit headers are written on every decision.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";

    private final RateLimitService rateLimitService;
    private final SecurityUtils securityUtils;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String ipAddress = securityUtils.resolveClientIp(
                request.getHeader("X-Forwarded-For"), request.getHeader("X-Real-IP"), request.getRemoteAddr());
        EndpointClass endpointClass = classify(request.getMethod(), request.getRequestURI());

        RateLimitDecision decision = rateLimitService.check("ip:" + ipAddress, endpointClass);
        response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
        response.setHeader(HEADER_RESET, String.valueOf(decision.resetAt().getEpochSecond()));

        if (!decision.allowed()) {
            log.warn("Request rejected by rate limit: ip={}, class={}", securityUtils.maskIp(ipAddress), endpointClass);
            throw new RateLimitedException(Duration.ofSeconds(decision.retryAfterSeconds()));
        }
        return true;
    }

    static EndpointClass classify(String method, String path) {
        if (path == null) {
            return EndpointClass.DEFAULT;
        }
        if (path.startsWith("/api/v1/admin/cleanup")) {
            return EndpointClass.CLEANUP;
        }
        if (path.startsWith("/api/v1/revocations/")
                || ("POST".equals(method) && path.matches("/api/v1/keys/[^/]+/revoke"))) {
            return EndpointClass.REVOKE;
        }
        if ("POST".equals(method) && path.equals("/api/v1/keys")) {
            return EndpointClass.REGISTER;
        }
        if (path.startsWith("/api/v1/publish")) {
            return EndpointClass.PUBLISH;
        }
        if (path.startsWith("/api/v1/subscribe")) {
            return EndpointClass.SUBSCRIBE;
        }
        return EndpointClass.DEFAULT;
    }
}

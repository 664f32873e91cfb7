package com.securenotify.keysvc.domain.ratelimit;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Redis-backed sliding window. The whole evict/count/admit step runs as one Lua script,
 * so concurrent callers on any number of instances observe a single serial order.
 * Timestamps come from the Redis server clock.
 */
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);

    static final String KEY_PREFIX = "ratelimit:";

    private static final String SLIDING_WINDOW_SCRIPT = """
            local key = KEYS[1]
            local seqKey = KEYS[2]
            local window = tonumber(ARGV[1])
            local limit = tonumber(ARGV[2])
            local t = redis.call('TIME')
            local now = tonumber(t[1]) * 1000 + math.floor(tonumber(t[2]) / 1000)
            redis.call('ZREMRANGEBYSCORE', key, '-inf', now - window)
            local count = redis.call('ZCARD', key)
            local allowed = 0
            if count < limit then
              local seq = redis.call('INCR', seqKey)
              redis.call('ZADD', key, now, string.format('%d-%d', now, seq))
              redis.call('PEXPIRE', key, window + 1000)
              redis.call('PEXPIRE', seqKey, window + 1000)
              allowed = 1
              count = count + 1
            end
            local oldest = redis.call('ZRANGE', key, 0, 0, 'WITHSCORES')
            local oldestScore = now
            if oldest[2] then
              oldestScore = tonumber(oldest[2])
            end
            return {allowed, limit - count, oldestScore, now}
            """;

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<List<Object>> script;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, Clock clock) {
        this(redisTemplate, clock, defaultCircuitBreaker());
    }

    RedisRateLimiter(StringRedisTemplate redisTemplate, Clock clock, CircuitBreaker circuitBreaker) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.circuitBreaker = circuitBreaker;
        this.script = slidingWindowScript();
    }

    private static RedisScript<List<Object>> slidingWindowScript() {
        @SuppressWarnings("unchecked")
        Class<List<Object>> resultType = (Class<List<Object>>) (Class<?>) List.class;
        DefaultRedisScript<List<Object>> redisScript = new DefaultRedisScript<>();
        redisScript.setScriptText(SLIDING_WINDOW_SCRIPT);
        redisScript.setResultType(resultType);
        return redisScript;
    }

    private static CircuitBreaker defaultCircuitBreaker() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        return CircuitBreakerRegistry.of(config).circuitBreaker("rateLimitStore");
    }

    @Override
    public RateLimitDecision check(String key, RateLimitRule rule) {
        String windowKey = windowKey(key);
        List<String> keys = List.of(windowKey, windowKey + ":seq");
        List<Object> result;
        try {
            result = circuitBreaker.executeSupplier(() -> redisTemplate.execute(script, keys,
                    String.valueOf(rule.windowMs()), String.valueOf(rule.maxRequests())));
        } catch (CallNotPermittedException e) {
            log.warn("Rate limit store circuit open, denying request");
            return RateLimitDecision.unavailable(rule, clock.instant());
        } catch (RuntimeException e) {
            log.error("Rate limit store unavailable, denying request: {}", e.getMessage());
            return RateLimitDecision.unavailable(rule, clock.instant());
        }
        return toDecision(result, rule);
    }

    RateLimitDecision toDecision(List<?> result, RateLimitRule rule) {
        if (result == null || result.size() < 4) {
            log.error("Rate limit script returned malformed result: {}", result);
            return RateLimitDecision.unavailable(rule, clock.instant());
        }
        try {
            boolean allowed = asLong(result.get(0)) == 1L;
            int remaining = (int) asLong(result.get(1));
            long oldest = asLong(result.get(2));
            long now = asLong(result.get(3));
            Instant resetAt = Instant.ofEpochMilli(oldest + rule.windowMs());
            if (allowed) {
                return RateLimitDecision.allow(rule.maxRequests(), remaining, resetAt);
            }
            long waitMs = oldest + rule.windowMs() - now;
            return RateLimitDecision.deny(rule.maxRequests(), resetAt, (waitMs + 999) / 1000);
        } catch (RuntimeException e) {
            log.error("Rate limit script returned unparseable result: {}", result);
            return RateLimitDecision.unavailable(rule, clock.instant());
        }
    }

    private static long asLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            return Long.parseLong(text.trim());
        }
        throw new IllegalArgumentException("Unexpected script value: " + value);
    }

    /**
     * Hash-tagged so the window set and its sequence counter land in the same cluster slot.
     */
    static String windowKey(String key) {
        return "{" + KEY_PREFIX + key + "}";
    }

    public boolean isAvailable() {
        return circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    public String circuitState() {
        return circuitBreaker.getState().name();
    }

    @Override
    public String storeName() {
        return "redis";
    }
}

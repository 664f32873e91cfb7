package com.securenotify.keysvc.domain.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-instance sliding window kept in a Caffeine cache.
 * Each key is updated inside {@code asMap().compute}, which serializes callers on the same key.
 *
 * <p>The key count is bounded by {@code maxEntries}. When a new key needs room, windows whose
 * requests have all aged out are dropped first; if that is not enough, the least recently
 * checked key is evicted.
 */
@Slf4j
public class InMemoryRateLimiter implements RateLimiter {

    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    // longest configurable window; anything idle past this holds no in-window entries
    private static final Duration MAX_IDLE = Duration.ofHours(1);

    private final Cache<String, Window> windows;
    private final Clock clock;
    private final int maxEntries;
    private final AtomicLong touches = new AtomicLong();

    public InMemoryRateLimiter(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(MAX_IDLE)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public RateLimitDecision check(String key, RateLimitRule rule) {
        if (!windows.asMap().containsKey(key)) {
            ensureCapacity();
        }
        long now = clock.millis();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        windows.asMap().compute(key, (k, existing) -> {
            Window window = existing != null ? existing : new Window();
            window.windowMs = rule.windowMs();
            window.lastTouch = touches.incrementAndGet();
            window.evictUpTo(now - rule.windowMs());
            int count = window.timestamps.size();
            if (count < rule.maxRequests()) {
                window.timestamps.addLast(now);
                long oldest = window.timestamps.peekFirst();
                decision[0] = RateLimitDecision.allow(rule.maxRequests(), rule.maxRequests() - count - 1,
                        Instant.ofEpochMilli(oldest + rule.windowMs()));
            } else {
                long oldest = window.timestamps.peekFirst();
                long waitMs = oldest + rule.windowMs() - now;
                decision[0] = RateLimitDecision.deny(rule.maxRequests(),
                        Instant.ofEpochMilli(oldest + rule.windowMs()), (waitMs + 999) / 1000);
            }
            return window;
        });
        return decision[0];
    }

    @Override
    public void sweep() {
        long now = clock.millis();
        ConcurrentMap<String, Window> map = windows.asMap();
        int before = map.size();
        for (String key : map.keySet()) {
            map.computeIfPresent(key, (k, window) -> {
                window.evictUpTo(now - window.windowMs);
                return window.timestamps.isEmpty() ? null : window;
            });
        }
        int removed = before - map.size();
        if (removed > 0) {
            log.debug("Swept {} idle rate limit windows", removed);
        }
    }

    public long size() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    @Override
    public String storeName() {
        return "memory";
    }

    private synchronized void ensureCapacity() {
        ConcurrentMap<String, Window> map = windows.asMap();
        if (map.size() < maxEntries) {
            return;
        }
        sweep();
        while (map.size() >= maxEntries) {
            String coldest = null;
            long coldestTouch = Long.MAX_VALUE;
            for (Map.Entry<String, Window> entry : map.entrySet()) {
                long touch = entry.getValue().lastTouch;
                if (touch < coldestTouch) {
                    coldestTouch = touch;
                    coldest = entry.getKey();
                }
            }
            if (coldest == null) {
                return;
            }
            map.remove(coldest);
            log.debug("Rate limit store full, evicted least recently used window");
        }
    }

    private static final class Window {
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private volatile long windowMs;
        private volatile long lastTouch;

        void evictUpTo(long boundary) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= boundary) {
                timestamps.pollFirst();
            }
        }
    }
}

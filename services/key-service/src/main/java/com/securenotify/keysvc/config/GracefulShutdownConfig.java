package com.securenotify.keysvc.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drain state for shutdown. Once the context starts closing, readiness reports down and
 * scheduled cleanup sweeps are skipped, while in-flight requests finish under
 * {@code server.shutdown=graceful}.
 */
@Configuration
@Slf4j
public class GracefulShutdownConfig {

    private final AtomicBoolean draining = new AtomicBoolean(false);

    @Bean
    public ApplicationListener<ContextClosedEvent> drainOnContextClose() {
        return event -> markDraining();
    }

    public void markDraining() {
        if (draining.compareAndSet(false, true)) {
            log.info("Shutdown started: readiness down, scheduled cleanup suspended");
        }
    }

    public boolean isDraining() {
        return draining.get();
    }

    /**
     * Runs a background task unless shutdown has begun.
     *
     * @return whether the task ran
     */
    public boolean runUnlessDraining(String taskName, Runnable task) {
        if (draining.get()) {
            log.info("Skipping {} during shutdown", taskName);
            return false;
        }
        task.run();
        return true;
    }
}

package com.securenotify.keysvc.domain.cleanup;

import com.securenotify.keysvc.config.GracefulShutdownConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Nightly cleanup sweep. Disabled with {@code app.cleanup.scheduled-enabled=false} when an
 * external scheduler calls the trigger endpoint instead.
 */
@Component
@ConditionalOnProperty(name = "app.cleanup.scheduled-enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CleanupScheduler {

    private final CleanupService cleanupService;
    private final GracefulShutdownConfig shutdown;

    @Scheduled(cron = "${app.cleanup.cron:0 0 3 * * *}")
    public void runScheduledCleanup() {
        shutdown.runUnlessDraining("scheduled cleanup", this::sweep);
    }

    void sweep() {
        log.info("Scheduled cleanup starting");
        CleanupReport report = cleanupService.executeFullCleanup();
        if (report.hasErrors()) {
            log.warn("Scheduled cleanup completed with {} failed batches", report.errors().size());
        }
    }
}

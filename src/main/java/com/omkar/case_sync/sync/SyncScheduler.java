package com.omkar.case_sync.sync;

import com.omkar.case_sync.config.SyncConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the background sync job. Passes run on a single thread with a fixed
 * delay between the end of one pass and the start of the next, so they never
 * overlap. Stopping lets a running pass finish up to the shutdown timeout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler {
    private final CaseSynchronizer caseSynchronizer;
    private final SyncConfig syncConfig;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> syncTask;

    @PostConstruct
    public void init() {
        if (syncConfig.isEnabled()) {
            start();
        } else {
            log.info("Background case sync disabled");
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "case-sync");
            thread.setDaemon(true);
            return thread;
        });
        syncTask = scheduler.scheduleWithFixedDelay(
                this::runPass,
                syncConfig.getInitialDelay().toMillis(),
                syncConfig.getInterval().toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("Background case sync started (every {} ms)", syncConfig.getInterval().toMillis());
    }

    // An exception escaping a fixed-delay task cancels every later run
    private void runPass() {
        try {
            caseSynchronizer.runPass();
        } catch (RuntimeException e) {
            log.error("Sync pass threw unexpectedly, next pass still scheduled", e);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }

        syncTask.cancel(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(syncConfig.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sync pass still running after {} ms, interrupting", syncConfig.getShutdownTimeout().toMillis());
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        syncTask = null;
        log.info("Background case sync stopped");
    }

    public synchronized boolean isRunning() {
        return syncTask != null && !syncTask.isCancelled();
    }
}

package com.omkar.case_sync.sync;

import com.omkar.case_sync.config.IntempusConfig;
import com.omkar.case_sync.intempus.IntempusClient;
import com.omkar.case_sync.metrics.MetricsCollector;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Runs one full reconciliation pass from id 0 against the Intempus listing.
 * A pass never throws: every failure is logged, recorded and returned, and
 * the next scheduled pass starts over from scratch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseSynchronizer {
    private final IntempusClient intempusClient;
    private final CaseReconciler caseReconciler;
    private final IntempusConfig intempusConfig;
    private final MetricsCollector metricsCollector;

    private final SyncStatus status = new SyncStatus();

    public Result<SyncReport> runPass() {
        long startTime = System.currentTimeMillis();
        markStarted();
        log.info("Fetching cases from Intempus");

        Result<SyncReport> outcome;
        try {
            outcome = caseReconciler.reconcile(intempusClient.streamCases(intempusConfig.getPageLimit()));
        } catch (RuntimeException e) {
            log.error("Failed to synchronize with Intempus", e);
            outcome = Result.failure(ErrorDetail.internal(e));
        }

        try {
            recordOutcome(outcome, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            log.error("Failed to record sync pass outcome", e);
        }
        markFinished(outcome);
        return outcome;
    }

    private void recordOutcome(Result<SyncReport> outcome, long latency) {
        if (outcome.isSuccess()) {
            SyncReport report = outcome.get();
            log.info("Synchronized cases in {} ms: {} pages, {} inserted, {} updated, {} deleted, {} unchanged",
                    latency, report.getPages(), report.getInserted(), report.getUpdated(),
                    report.getDeleted(), report.getUnchanged());
            metricsCollector.recordSyncPass(report, latency);
        } else {
            ErrorDetail error = outcome.getError();
            log.error("Synchronization pass aborted after {} ms: {} {} ({})",
                    latency, error.getStatusCode(), error.getTitle(), error.getDetail());
            metricsCollector.recordSyncFailure(error, latency);
        }
    }

    public synchronized SyncStatus getStatus() {
        return SyncStatus.builder()
                .completedPasses(status.getCompletedPasses())
                .failedPasses(status.getFailedPasses())
                .lastStartedAt(status.getLastStartedAt())
                .lastFinishedAt(status.getLastFinishedAt())
                .lastReport(status.getLastReport())
                .lastError(status.getLastError())
                .build();
    }

    private synchronized void markStarted() {
        status.setLastStartedAt(Instant.now());
    }

    private synchronized void markFinished(Result<SyncReport> outcome) {
        status.setLastFinishedAt(Instant.now());
        if (outcome.isSuccess()) {
            status.setCompletedPasses(status.getCompletedPasses() + 1);
            status.setLastReport(outcome.get());
            status.setLastError(null);
        } else {
            status.setFailedPasses(status.getFailedPasses() + 1);
            status.setLastError(outcome.getError());
        }
    }
}

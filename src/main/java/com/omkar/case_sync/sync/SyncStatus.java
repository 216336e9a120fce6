package com.omkar.case_sync.sync;

import com.omkar.case_sync.shared.ErrorDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncStatus {
    private long completedPasses;
    private long failedPasses;
    private Instant lastStartedAt;
    private Instant lastFinishedAt;
    private SyncReport lastReport;
    private ErrorDetail lastError;
}

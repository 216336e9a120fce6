package com.omkar.case_sync.sync;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters for one reconciliation pass.
 */
@Getter
@ToString
public class SyncReport {
    private int pages;
    private int inserted;
    private int updated;
    private int unchanged;
    private int deleted;
    private int staleRemote;
    private int skipped;
    private long watermark;

    void recordPage() { pages++; }
    void recordInsert() { inserted++; }
    void recordUpdate() { updated++; }
    void recordUnchanged() { unchanged++; }
    void recordDelete() { deleted++; }
    void recordStaleRemote() { staleRemote++; }
    void recordSkipped() { skipped++; }

    void raiseWatermark(long candidate) {
        watermark = Math.max(watermark, candidate);
    }

    public int getWrites() {
        return inserted + updated + deleted;
    }
}

package com.omkar.case_sync.sync;

import com.omkar.case_sync.store.CaseRecord;
import com.omkar.case_sync.store.CaseStore;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Forward-only cursor over local cases in ascending id order.
 *
 * Rows are read in keyset batches ({@code id >= next ORDER BY id LIMIT n}) so
 * at most one batch is held in memory and commits between batches are safe.
 * Once a read comes back short the cursor stays exhausted; records the
 * reconciler inserts afterwards are never revisited.
 */
class LocalCaseCursor {
    private final CaseStore caseStore;
    private final int batchSize;
    private final Deque<CaseRecord> buffer = new ArrayDeque<>();

    private long nextFrom;
    private boolean exhausted = false;

    LocalCaseCursor(CaseStore caseStore, long fromId, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.caseStore = caseStore;
        this.nextFrom = fromId;
        this.batchSize = batchSize;
    }

    /**
     * @return the current record, or null when no local records remain
     */
    CaseRecord peek() {
        if (buffer.isEmpty() && !exhausted) {
            fill();
        }
        return buffer.peekFirst();
    }

    void advance() {
        buffer.pollFirst();
    }

    /**
     * Raises the lower bound of the next batch read to the pass watermark.
     */
    void raiseFloor(long watermark) {
        nextFrom = Math.max(nextFrom, watermark);
    }

    private void fill() {
        List<CaseRecord> rows = caseStore.scanFrom(nextFrom, batchSize);
        buffer.addAll(rows);
        if (!rows.isEmpty()) {
            nextFrom = rows.get(rows.size() - 1).getId() + 1;
        }
        if (rows.size() < batchSize) {
            exhausted = true;
        }
    }
}

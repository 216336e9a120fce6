package com.omkar.case_sync.sync;

import com.omkar.case_sync.config.SyncConfig;
import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.Result;
import com.omkar.case_sync.store.CasePayloadMapper;
import com.omkar.case_sync.store.CaseRecord;
import com.omkar.case_sync.store.CaseStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Iterator;
import java.util.OptionalLong;

/**
 * Brings the local case table in line with a stream of Intempus pages.
 *
 * Single forward two-pointer merge: the remote pages and a local cursor are
 * both ordered by id, so each side is read once. Every page is applied in its
 * own transaction. Local records the stream never mentions are deleted once
 * the stream is exhausted.
 *
 * For an id present on both sides the higher logical timestamp wins; a remote
 * version lower than the local one is left alone and logged. The same rule
 * applies when the case API writes a case the cursor has already passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaseReconciler {
    private final CaseStore caseStore;
    private final CasePayloadMapper payloadMapper;
    private final TransactionTemplate transactionTemplate;
    private final SyncConfig syncConfig;

    public Result<SyncReport> reconcile(Iterator<Result<CasePage>> pages) {
        SyncReport report = new SyncReport();
        LocalCaseCursor local = null;

        try {
            while (pages.hasNext()) {
                Result<CasePage> fetched = pages.next();
                if (fetched.isFailure()) {
                    log.error("Page fetch failed after {} pages: {}", report.getPages(), fetched.getError().getDetail());
                    return Result.failure(fetched.getError());
                }

                CasePage page = fetched.get();
                if (local == null) {
                    local = new LocalCaseCursor(caseStore, report.getWatermark(), syncConfig.getLocalBatchSize());
                }

                LocalCaseCursor cursor = local;
                transactionTemplate.executeWithoutResult(status -> mergePage(page, cursor, report));

                OptionalLong maxId = page.maxId();
                if (maxId.isPresent()) {
                    report.raiseWatermark(maxId.getAsLong() + 1);
                    local.raiseFloor(report.getWatermark());
                }
                report.recordPage();
            }

            if (local == null) {
                log.warn("Remote stream produced no pages, local cases left untouched");
                return Result.success(report);
            }

            LocalCaseCursor cursor = local;
            transactionTemplate.executeWithoutResult(status -> deleteRemaining(cursor, report));
            return Result.success(report);
        } catch (DataAccessException | TransactionException e) {
            log.error("Local store failure after {} committed pages", report.getPages(), e);
            return Result.failure(ErrorDetail.localStore(e));
        }
    }

    private void mergePage(CasePage page, LocalCaseCursor local, SyncReport report) {
        Iterator<CaseResponse> remoteIt = page.getObjects().iterator();
        CaseResponse remote = nextRemote(remoteIt, report);

        // Stops when the page runs out; leftover local rows may still match a later page
        while (remote != null) {
            CaseRecord current = local.peek();

            if (current == null || remote.getId() < current.getId()) {
                insertRemote(remote, report);
                remote = nextRemote(remoteIt, report);
            } else if (remote.getId() == current.getId()) {
                applyVersion(remote, current, report);
                local.advance();
                remote = nextRemote(remoteIt, report);
            } else {
                caseStore.delete(current.getId());
                report.recordDelete();
                local.advance();
            }
        }
    }

    private void insertRemote(CaseResponse remote, SyncReport report) {
        CaseRecord record = payloadMapper.toRecord(remote);
        if (caseStore.insertIfAbsent(record)) {
            report.recordInsert();
            return;
        }

        // Written by the case API after the cursor moved past this id
        log.info("Case {} appeared locally during the pass, comparing versions", remote.getId());
        CaseRecord current = caseStore.get(remote.getId()).orElse(null);
        if (current == null) {
            caseStore.insert(record);
            report.recordInsert();
        } else {
            applyVersion(remote, current, report);
        }
    }

    private void applyVersion(CaseResponse remote, CaseRecord current, SyncReport report) {
        long remoteVersion = remote.version();
        if (remoteVersion > current.getLogicalTimestamp()) {
            caseStore.updateVersionAndPayload(current.getId(), remoteVersion, payloadMapper.toPayload(remote));
            report.recordUpdate();
        } else if (remoteVersion < current.getLogicalTimestamp()) {
            log.warn("Case {} has remote version {} below local version {}, keeping local",
                    current.getId(), remoteVersion, current.getLogicalTimestamp());
            report.recordStaleRemote();
        } else {
            report.recordUnchanged();
        }
    }

    private CaseResponse nextRemote(Iterator<CaseResponse> remoteIt, SyncReport report) {
        while (remoteIt.hasNext()) {
            CaseResponse candidate = remoteIt.next();
            if (candidate.getId() < report.getWatermark()) {
                log.warn("Case {} already resolved earlier in this pass (watermark {}), skipping",
                        candidate.getId(), report.getWatermark());
                report.recordSkipped();
                continue;
            }
            return candidate;
        }
        return null;
    }

    private void deleteRemaining(LocalCaseCursor local, SyncReport report) {
        for (CaseRecord leftover = local.peek(); leftover != null; leftover = local.peek()) {
            caseStore.delete(leftover.getId());
            report.recordDelete();
            local.advance();
        }
    }
}

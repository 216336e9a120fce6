package com.omkar.case_sync.cases;

import com.omkar.case_sync.intempus.IntempusClient;
import com.omkar.case_sync.intempus.dto.CaseRequest;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.Result;
import com.omkar.case_sync.store.CasePayloadMapper;
import com.omkar.case_sync.store.CaseRecord;
import com.omkar.case_sync.store.CaseStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

/**
 * Single-case writes. Intempus is always written first; the local copy only
 * changes once Intempus has accepted the change, except that a delete of a
 * case Intempus no longer knows still removes it locally.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CaseService {
    private final IntempusClient intempusClient;
    private final CaseStore caseStore;
    private final CasePayloadMapper payloadMapper;

    public Result<CaseResponse> create(CaseRequest request) {
        List<String> problems = request.validateForCreate();
        if (!problems.isEmpty()) {
            return Result.failure(ErrorDetail.validation(problems));
        }

        log.info("Creating case {}", request.getNumber());
        return intempusClient.createCase(request)
                .flatMap(created -> storeLocally(created, this::insertOrRefresh));
    }

    public Result<CaseResponse> update(long id, CaseRequest request) {
        List<String> problems = request.validateForUpdate();
        if (!problems.isEmpty()) {
            return Result.failure(ErrorDetail.validation(problems));
        }

        log.info("Updating case {}", id);
        return intempusClient.updateCase(id, request)
                .flatMap(updated -> storeLocally(updated, record -> {
                    if (!caseStore.updateIfNewer(record)) {
                        log.info("Case {} not changed locally (absent or already at version >= {})",
                                record.getId(), record.getLogicalTimestamp());
                    }
                }));
    }

    public Result<Void> delete(long id) {
        log.info("Deleting case {}", id);
        Result<Void> remote = intempusClient.deleteCase(id);

        if (remote.isFailure()) {
            // Someone may already have deleted the case in Intempus
            if (!remote.getError().isNotFound()) {
                return remote;
            }
            log.info("Case {} already absent in Intempus, removing local copy", id);
        }

        try {
            caseStore.delete(id);
        } catch (DataAccessException e) {
            log.error("Failed to delete case {} locally", id, e);
            return Result.failure(ErrorDetail.localStore(e));
        }
        log.info("Deleted case {}", id);
        return Result.success();
    }

    private void insertOrRefresh(CaseRecord record) {
        try {
            caseStore.insert(record);
        } catch (DuplicateKeyException e) {
            // A sync pass mirrored the case first
            caseStore.updateIfNewer(record);
        }
    }

    private Result<CaseResponse> storeLocally(CaseResponse remote, Consumer<CaseRecord> write) {
        try {
            write.accept(payloadMapper.toRecord(remote));
            return Result.success(remote);
        } catch (DataAccessException e) {
            log.error("Failed to store case {} locally", remote.getId(), e);
            return Result.failure(ErrorDetail.localStore(e));
        }
    }
}

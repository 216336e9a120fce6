package com.omkar.case_sync.cases;

import com.omkar.case_sync.intempus.dto.CaseRequest;
import com.omkar.case_sync.metrics.MetricsCollector;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.ErrorKind;
import com.omkar.case_sync.shared.Result;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.function.Supplier;

@Slf4j
@RestController
@RequestMapping("/case")
@RequiredArgsConstructor
public class CaseController {
    private final CaseService caseService;
    private final MetricsCollector metricsCollector;

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CaseRequest request) {
        return handle("CREATE", null, HttpStatus.CREATED, () -> caseService.create(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@PathVariable long id, @RequestBody CaseRequest request) {
        return handle("UPDATE", id, HttpStatus.OK, () -> caseService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable long id) {
        return handle("DELETE", id, HttpStatus.NO_CONTENT, () -> caseService.delete(id));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.from(ErrorDetail.validation(List.of("Malformed request body"))));
    }

    private ResponseEntity<?> handle(String operation, Long caseId, HttpStatus successStatus,
                                     Supplier<? extends Result<?>> action) {
        long startTime = System.currentTimeMillis();

        try {
            Result<?> result = action.get();
            long latency = System.currentTimeMillis() - startTime;

            if (result.isSuccess()) {
                metricsCollector.recordCaseWrite(operation, caseId, "SUCCESS", latency);
                if (successStatus == HttpStatus.NO_CONTENT) {
                    return ResponseEntity.noContent().build();
                }
                return ResponseEntity.status(successStatus).body(result.get());
            }

            ErrorDetail error = result.getError();
            metricsCollector.recordCaseWrite(operation, caseId, error.getKind().name(), latency);
            if (error.getKind() == ErrorKind.LOCAL_STORE || error.getKind() == ErrorKind.INTERNAL) {
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError());
            }
            return ResponseEntity.status(error.getStatusCode()).body(ErrorResponse.from(error));
        } catch (Exception e) {
            long latency = System.currentTimeMillis() - startTime;
            metricsCollector.recordCaseWrite(operation, caseId, "ERROR", latency);

            log.error("Error handling {} for case {}", operation, caseId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError());
        }
    }
}

package com.omkar.case_sync;

import com.omkar.case_sync.config.IntempusConfig;
import com.omkar.case_sync.intempus.IntempusClient;
import com.omkar.case_sync.intempus.PagedCaseStream;
import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import com.omkar.case_sync.intempus.dto.Meta;
import com.omkar.case_sync.metrics.MetricsCollector;
import com.omkar.case_sync.metrics.MetricsEvent;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.shared.ErrorKind;
import com.omkar.case_sync.shared.Result;
import com.omkar.case_sync.store.CaseRecord;
import com.omkar.case_sync.store.CaseStore;
import com.omkar.case_sync.sync.CaseReconciler;
import com.omkar.case_sync.sync.CaseSynchronizer;
import com.omkar.case_sync.sync.SyncReport;
import com.omkar.case_sync.sync.SyncStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.jdbc.JdbcTestUtils;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
public class CaseSynchronizerTests {

    @Autowired
    private CaseSynchronizer caseSynchronizer;

    @Autowired
    private CaseStore caseStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MetricsCollector metricsCollector;

    @MockBean
    private IntempusClient intempusClient;

    @BeforeEach
    public void setUp() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "cases");
        metricsCollector.clearBuffer();
    }

    @Test
    public void testPassConvergesLocalStore() {
        caseStore.insert(new CaseRecord(2, 1, "{}"));
        caseStore.insert(new CaseRecord(4, 1, "{}"));
        // Pages of two: [1, 3] then [5]
        List<CaseResponse> remote = List.of(remote(1, 1), remote(3, 1), remote(5, 1));
        when(intempusClient.streamCases(100)).thenReturn(new PagedCaseStream((limit, offset) -> {
            int from = offset / limit * 2;
            int to = Math.min(from + 2, remote.size());
            return Result.success(page(to < remote.size(), remote.subList(from, to)));
        }, 100));

        Result<SyncReport> result = caseSynchronizer.runPass();

        assertTrue(result.isSuccess());
        assertEquals(2, result.get().getPages());
        assertEquals(List.of(1L, 3L, 5L), localIds());

        SyncStatus status = caseSynchronizer.getStatus();
        assertTrue(status.getCompletedPasses() >= 1);
        assertNull(status.getLastError());
        assertSame(result.get(), status.getLastReport());

        MetricsEvent event = metricsCollector.getAllEvents().get(0);
        assertEquals("SYNC_PASS", event.getEventType());
        assertEquals("SUCCESS", event.getResult());
        verify(intempusClient).streamCases(100);
    }

    @Test
    public void testTransportFailureIsReturnedNotThrown() {
        caseStore.insert(new CaseRecord(1, 1, "{}"));
        long failedBefore = caseSynchronizer.getStatus().getFailedPasses();
        when(intempusClient.streamCases(100)).thenReturn(new PagedCaseStream((limit, offset) ->
                Result.failure(ErrorDetail.transport(new ResourceAccessException("Connection refused"))), 100));

        Result<SyncReport> result = assertDoesNotThrow(() -> caseSynchronizer.runPass());

        assertTrue(result.isFailure());
        assertEquals(ErrorKind.TRANSPORT, result.getError().getKind());
        assertEquals(failedBefore + 1, caseSynchronizer.getStatus().getFailedPasses());
        assertEquals(ErrorKind.TRANSPORT, caseSynchronizer.getStatus().getLastError().getKind());
        assertEquals(List.of(1L), localIds(), "A failed first page leaves the local store untouched");
        assertEquals("TRANSPORT", metricsCollector.getAllEvents().get(0).getResult());
    }

    @Test
    public void testUnexpectedExceptionBecomesInternalFailure() {
        when(intempusClient.streamCases(100)).thenThrow(new IllegalStateException("client not ready"));

        Result<SyncReport> result = assertDoesNotThrow(() -> caseSynchronizer.runPass());

        assertTrue(result.isFailure());
        assertEquals(ErrorKind.INTERNAL, result.getError().getKind());
        assertEquals("client not ready", result.getError().getDetail());
    }

    @Test
    public void testMetricsFailureStillCompletesPass() {
        CaseReconciler reconciler = mock(CaseReconciler.class);
        MetricsCollector brokenMetrics = mock(MetricsCollector.class);
        IntempusClient client = mock(IntempusClient.class);
        SyncReport report = new SyncReport();
        when(reconciler.reconcile(any())).thenReturn(Result.success(report));
        doThrow(new IllegalStateException("buffer closed")).when(brokenMetrics).recordSyncPass(any(), anyLong());
        CaseSynchronizer synchronizer = new CaseSynchronizer(client, reconciler, new IntempusConfig(), brokenMetrics);

        Result<SyncReport> result = assertDoesNotThrow(() -> synchronizer.runPass());

        assertTrue(result.isSuccess());
        assertEquals(1, synchronizer.getStatus().getCompletedPasses());
        assertSame(report, synchronizer.getStatus().getLastReport());
    }

    private List<Long> localIds() {
        List<Long> ids = new ArrayList<>();
        for (CaseRecord record : caseStore.scanFrom(0, Integer.MAX_VALUE)) {
            ids.add(record.getId());
        }
        return ids;
    }

    private static CasePage page(boolean hasMore, List<CaseResponse> cases) {
        return CasePage.builder()
                .meta(Meta.builder()
                        .limit(100)
                        .next(hasMore ? "/web/v1/case/?next" : null)
                        .totalCount(3)
                        .build())
                .objects(new ArrayList<>(cases))
                .build();
    }

    private static CaseResponse remote(long id, long version) {
        return new CaseResponse(id, version).attribute("name", "Case " + id);
    }
}

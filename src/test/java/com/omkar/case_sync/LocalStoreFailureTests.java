package com.omkar.case_sync;

import com.omkar.case_sync.intempus.IntempusClient;
import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.intempus.dto.CaseRequest;
import com.omkar.case_sync.intempus.dto.CaseResponse;
import com.omkar.case_sync.intempus.dto.Meta;
import com.omkar.case_sync.metrics.MetricsCollector;
import com.omkar.case_sync.shared.ErrorKind;
import com.omkar.case_sync.shared.Result;
import com.omkar.case_sync.store.CaseRecord;
import com.omkar.case_sync.store.CaseStore;
import com.omkar.case_sync.sync.CaseReconciler;
import com.omkar.case_sync.sync.SyncReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.jdbc.JdbcTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Local store write failures, for both a sync pass and the case API.
 */
@SpringBootTest
@AutoConfigureMockMvc
public class LocalStoreFailureTests {

    private static final DataAccessResourceFailureException DISK_FULL =
            new DataAccessResourceFailureException("disk full");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CaseReconciler caseReconciler;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MetricsCollector metricsCollector;

    @SpyBean
    private CaseStore caseStore;

    @MockBean
    private IntempusClient intempusClient;

    @BeforeEach
    public void setUp() {
        JdbcTestUtils.deleteFromTables(jdbcTemplate, "cases");
        metricsCollector.clearBuffer();
    }

    // ============ Reconciliation ============

    @Test
    public void testWriteFailureRollsBackOnlyTheInFlightPage() {
        caseStore.insert(new CaseRecord(9, 1, "{}"));
        doThrow(DISK_FULL).when(caseStore).insertIfAbsent(argThat(record -> record.getId() == 4));

        Result<SyncReport> result = caseReconciler.reconcile(List.of(
                Result.success(page(true, remote(1), remote(2))),
                Result.success(page(false, remote(3), remote(4)))).iterator());

        assertTrue(result.isFailure());
        assertEquals(ErrorKind.LOCAL_STORE, result.getError().getKind());
        assertEquals(500, result.getError().getStatusCode());
        // Page 1 committed, case 3 rolled back with page 2, case 9 not swept
        assertEquals(List.of(1L, 2L, 9L), localIds());
    }

    // ============ Case API ============

    @Test
    public void testCreateAnswersGenericErrorWhenLocalWriteFails() throws Exception {
        when(intempusClient.createCase(any(CaseRequest.class))).thenReturn(Result.success(remote(42)));
        doThrow(DISK_FULL).when(caseStore).insert(any(CaseRecord.class));

        mockMvc.perform(post("/case").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer\": \"/web/v1/customer/3/\", \"number\": \"C-42\", \"name\": \"Roof\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Internal Server Error"))
                .andExpect(jsonPath("$.detail").value("An unexpected error occurred"))
                .andExpect(content().string(not(containsString("disk full"))));

        verify(intempusClient).createCase(any(CaseRequest.class));
        assertEquals("LOCAL_STORE", metricsCollector.getAllEvents().get(0).getResult());
    }

    @Test
    public void testDeleteAnswersGenericErrorWhenLocalDeleteFails() throws Exception {
        caseStore.insert(new CaseRecord(9, 1, "{}"));
        when(intempusClient.deleteCase(9)).thenReturn(Result.success());
        doThrow(DISK_FULL).when(caseStore).delete(9);

        mockMvc.perform(delete("/case/9"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Internal Server Error"))
                .andExpect(content().string(not(containsString("disk full"))));

        assertTrue(caseStore.get(9).isPresent());
    }

    private List<Long> localIds() {
        return caseStore.scanFrom(0, Integer.MAX_VALUE).stream()
                .map(CaseRecord::getId)
                .collect(Collectors.toList());
    }

    private static CasePage page(boolean hasMore, CaseResponse... cases) {
        return CasePage.builder()
                .meta(Meta.builder()
                        .limit(cases.length)
                        .next(hasMore ? "/web/v1/case/?next" : null)
                        .totalCount(cases.length)
                        .build())
                .objects(new ArrayList<>(List.of(cases)))
                .build();
    }

    private static CaseResponse remote(long id) {
        return new CaseResponse(id, 1L).attribute("name", "Case " + id);
    }
}

package com.omkar.case_sync;

import com.omkar.case_sync.metrics.MetricsCollector;
import com.omkar.case_sync.metrics.MetricsEvent;
import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.sync.SyncReport;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsCollectorTests {

    @Test
    public void testBufferDropsOldestEventsWhenFull() {
        MetricsCollector collector = new MetricsCollector();

        for (long id = 0; id < MetricsCollector.MAX_BUFFER_SIZE + 5; id++) {
            collector.recordCaseWrite("CREATE", id, "SUCCESS", 1);
        }

        List<MetricsEvent> events = collector.getAllEvents();
        assertEquals(MetricsCollector.MAX_BUFFER_SIZE, events.size());
        assertEquals(5L, events.get(0).getCaseId());
    }

    @Test
    public void testExportsSyncEventsAsCsv() {
        MetricsCollector collector = new MetricsCollector();
        collector.recordSyncPass(new SyncReport(), 12);
        collector.recordSyncFailure(ErrorDetail.transport(new ResourceAccessException("timeout")), 30);

        String[] lines = collector.exportAsCSV().split("\n");

        assertEquals(3, lines.length);
        assertEquals(MetricsEvent.csvHeader(), lines[0]);
        assertTrue(lines[1].contains(",SYNC_PASS,PASS,,SUCCESS,12,pages=0"));
        assertTrue(lines[2].endsWith(",SYNC_PASS,PASS,,TRANSPORT,30,503 Network Error"));

        assertEquals(Map.of("SUCCESS", 1L, "TRANSPORT", 1L), collector.countResults(MetricsCollector.SYNC_PASS));
        assertTrue(collector.getEvents(MetricsCollector.CASE_WRITE).isEmpty());

        collector.clearBuffer();
        assertEquals(0, collector.getBufferSize());
    }
}

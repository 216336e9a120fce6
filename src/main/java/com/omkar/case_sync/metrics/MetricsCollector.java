package com.omkar.case_sync.metrics;

import com.omkar.case_sync.shared.ErrorDetail;
import com.omkar.case_sync.sync.SyncReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

@Slf4j
@Component
public class MetricsCollector {
    public static final int MAX_BUFFER_SIZE = 10000;
    public static final String SYNC_PASS = "SYNC_PASS";
    public static final String CASE_WRITE = "CASE_WRITE";

    private final Queue<MetricsEvent> eventBuffer = new ConcurrentLinkedQueue<>();

    // Reconciliation passes
    public void recordSyncPass(SyncReport report, long latencyMs) {
        addEvent(MetricsEvent.builder()
                .timestamp(Instant.now())
                .eventType(SYNC_PASS)
                .operation("PASS")
                .result("SUCCESS")
                .latencyMs(latencyMs)
                .details("pages=" + report.getPages()
                        + ",inserted=" + report.getInserted()
                        + ",updated=" + report.getUpdated()
                        + ",deleted=" + report.getDeleted()
                        + ",stale=" + report.getStaleRemote())
                .build());
    }

    public void recordSyncFailure(ErrorDetail error, long latencyMs) {
        addEvent(MetricsEvent.builder()
                .timestamp(Instant.now())
                .eventType(SYNC_PASS)
                .operation("PASS")
                .result(error.getKind().name())
                .latencyMs(latencyMs)
                .details(error.getStatusCode() + " " + error.getTitle())
                .build());
    }

    // Single-record writes from the case API
    public void recordCaseWrite(String operation, Long caseId, String result, long latencyMs) {
        addEvent(MetricsEvent.builder()
                .timestamp(Instant.now())
                .eventType(CASE_WRITE)
                .operation(operation)
                .caseId(caseId)
                .result(result)
                .latencyMs(latencyMs)
                .build());
    }

    private void addEvent(MetricsEvent event) {
        if (eventBuffer.size() >= MAX_BUFFER_SIZE) {
            eventBuffer.poll(); // Remove oldest if buffer full
        }
        eventBuffer.offer(event);
    }

    public List<MetricsEvent> getAllEvents() {
        return new LinkedList<>(eventBuffer);
    }

    public List<MetricsEvent> getEvents(String eventType) {
        return eventBuffer.stream()
                .filter(event -> eventType.equals(event.getEventType()))
                .collect(Collectors.toList());
    }

    // Result -> count for one event type, e.g. {SUCCESS=12, TRANSPORT=1}
    public Map<String, Long> countResults(String eventType) {
        return eventBuffer.stream()
                .filter(event -> eventType.equals(event.getEventType()))
                .collect(Collectors.groupingBy(MetricsEvent::getResult, TreeMap::new, Collectors.counting()));
    }

    public String exportAsCSV() {
        StringBuilder csv = new StringBuilder();
        csv.append(MetricsEvent.csvHeader()).append("\n");

        for (MetricsEvent event : eventBuffer) {
            csv.append(event.toCSV()).append("\n");
        }

        return csv.toString();
    }

    public void clearBuffer() {
        log.debug("Clearing {} metrics events", eventBuffer.size());
        eventBuffer.clear();
    }

    public int getBufferSize() {
        return eventBuffer.size();
    }
}

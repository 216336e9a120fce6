package com.omkar.case_sync.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/metrics")
@RequiredArgsConstructor
public class MetricsController {
    private final MetricsCollector metricsCollector;

    // Optional filter: ?type=SYNC_PASS or ?type=CASE_WRITE
    @GetMapping("/events")
    public List<MetricsEvent> events(@RequestParam(required = false) String type) {
        return type == null ? metricsCollector.getAllEvents() : metricsCollector.getEvents(type);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"case-sync-metrics.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(metricsCollector.exportAsCSV());
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("bufferSize", metricsCollector.getBufferSize());
        body.put("maxSize", MetricsCollector.MAX_BUFFER_SIZE);
        body.put("syncResults", metricsCollector.countResults(MetricsCollector.SYNC_PASS));
        body.put("caseWriteResults", metricsCollector.countResults(MetricsCollector.CASE_WRITE));
        return body;
    }

    @DeleteMapping("/clear")
    public ResponseEntity<Void> clear() {
        metricsCollector.clearBuffer();
        return ResponseEntity.noContent().build();
    }
}

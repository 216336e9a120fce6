package com.omkar.case_sync.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
public class MetricsEvent {
    private Instant timestamp;
    private String eventType;          // SYNC_PASS, CASE_WRITE
    private String operation;          // PASS, CREATE, UPDATE, DELETE
    private Long caseId;
    private String result;
    private Long latencyMs;
    private String details;

    public String toCSV() {
        return String.format("%s,%s,%s,%s,%s,%s,%s",
                timestamp,
                eventType,
                operation != null ? operation : "",
                caseId != null ? caseId : "",
                result != null ? result : "",
                latencyMs != null ? latencyMs : "",
                details != null ? details : ""
        );
    }

    public static String csvHeader() {
        return "timestamp,event_type,operation,case_id,result,latency_ms,details";
    }
}

package com.omkar.case_sync.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Local mirror of one Intempus case: the id, the logical timestamp seen at
 * the last sync, and the full case serialized as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseRecord {
    private long id;
    private long logicalTimestamp;
    private String payload;
}

package com.omkar.case_sync.intempus.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * One page of the Intempus case listing, ordered by ascending id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CasePage {
    private Meta meta;
    @Builder.Default
    private List<CaseResponse> objects = new ArrayList<>();

    public boolean hasMore() {
        return meta != null && meta.getNext() != null && !meta.getNext().isBlank();
    }

    public OptionalLong maxId() {
        return objects.stream().mapToLong(CaseResponse::getId).max();
    }
}

package com.omkar.case_sync.intempus;

import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.shared.Result;

@FunctionalInterface
public interface CasePageSource {

    /**
     * Fetches one page of cases ordered by ascending id.
     */
    Result<CasePage> fetchPage(int limit, int offset);
}

package com.omkar.case_sync.intempus;

import com.omkar.case_sync.intempus.dto.CasePage;
import com.omkar.case_sync.shared.Result;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily walks an offset-paginated case listing from offset 0.
 * Each call to {@link #next()} issues exactly one request. The stream ends
 * after a page without continuation, or right after yielding a failure.
 */
@Slf4j
public class PagedCaseStream implements Iterator<Result<CasePage>> {
    private final CasePageSource source;
    private final int limit;

    private int offset = 0;
    private boolean finished = false;

    public PagedCaseStream(CasePageSource source, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive: " + limit);
        }
        this.source = source;
        this.limit = limit;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Result<CasePage> next() {
        if (finished) {
            throw new NoSuchElementException("Case stream exhausted at offset " + offset);
        }

        log.debug("Fetching cases limit={} offset={}", limit, offset);
        Result<CasePage> page = source.fetchPage(limit, offset);

        if (page.isFailure() || !page.get().hasMore()) {
            finished = true;
        } else {
            offset += limit;
        }
        return page;
    }
}

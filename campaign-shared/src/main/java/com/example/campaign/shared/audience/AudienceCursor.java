package com.example.campaign.shared.audience;

import java.util.List;

/**
 * Keyset cursor over the ids of an audience, ascending. Safe to drain from several threads:
 * each call to {@link #nextPage()} hands out a distinct page.
 */
public class AudienceCursor {

    @FunctionalInterface
    interface PageFetcher {
        List<Long> fetch(long afterId, int limit);
    }

    private final PageFetcher fetcher;
    private final int pageSize;
    private long lastId;
    private boolean exhausted;

    AudienceCursor(PageFetcher fetcher, long afterId, int pageSize) {
        this.fetcher = fetcher;
        this.lastId = afterId;
        this.pageSize = pageSize;
    }

    static AudienceCursor exhausted() {
        AudienceCursor cursor = new AudienceCursor((after, limit) -> List.of(), 0L, 1);
        cursor.exhausted = true;
        return cursor;
    }

    /**
     * The next page of ids, or an empty list once the audience is drained.
     */
    public synchronized List<Long> nextPage() {
        if (exhausted) {
            return List.of();
        }
        List<Long> page = fetcher.fetch(lastId, pageSize);
        if (page.size() < pageSize) {
            exhausted = true;
        }
        if (!page.isEmpty()) {
            lastId = page.get(page.size() - 1);
        }
        return page;
    }
}

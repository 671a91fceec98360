package com.fixfinder.backend.shared;

import org.springframework.data.domain.PageRequest;

public final class PageRequests {

    private static final int MAX_LIMIT = 100;

    private PageRequests() {
    }

    /** Converts a 1-based page and a client-supplied limit into a bounded {@link PageRequest}. */
    public static PageRequest of(int page, int limit) {
        int safePage = Math.max(page, 1) - 1;
        int safeLimit = Math.min(Math.max(limit, 1), MAX_LIMIT);
        return PageRequest.of(safePage, safeLimit);
    }
}

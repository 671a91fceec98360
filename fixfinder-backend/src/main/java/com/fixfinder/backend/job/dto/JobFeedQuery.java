package com.fixfinder.backend.job.dto;

import com.fixfinder.backend.job.Urgency;

/**
 * Feed filters. {@code scope=all} disables distance ordering; {@code lat}/{@code lng} override the
 * professional's profile coordinates.
 */
public record JobFeedQuery(
        String q,
        String category,
        String city,
        String state,
        Urgency urgency,
        String scope,
        Double lat,
        Double lng
) {
    public static JobFeedQuery empty() {
        return new JobFeedQuery(null, null, null, null, null, null, null, null);
    }

    public boolean wantsDistance() {
        return !"all".equalsIgnoreCase(scope);
    }
}

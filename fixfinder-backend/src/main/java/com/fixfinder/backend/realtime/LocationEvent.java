package com.fixfinder.backend.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** Payload of the live-location relays; only {@code locationShared} carries {@code userName}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LocationEvent(
        Long conversationId,
        Long userId,
        String userName,
        Double lat,
        Double lng,
        Double accuracy,
        Instant timestamp
) {
    public static LocationEvent stopped(Long conversationId, Long userId) {
        return new LocationEvent(conversationId, userId, null, null, null, null, Instant.now());
    }
}

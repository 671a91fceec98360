package com.fixfinder.backend.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceUpdate(Long userId, @JsonProperty("isOnline") boolean online, Instant lastSeen) {
}

package com.fixfinder.backend.user;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Presence {

    @Column(name = "is_online", nullable = false)
    private boolean online = false;

    @Column(name = "last_seen")
    private Instant lastSeen;
}

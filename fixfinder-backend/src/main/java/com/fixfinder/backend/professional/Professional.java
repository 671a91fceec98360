package com.fixfinder.backend.professional;

import com.fixfinder.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/**
 * Service profile owned by a user with the PROFESSIONAL role. Jobs and applications point at the
 * profile, not at the user, so every authorization check maps the acting user to this row first.
 */
@Entity
@Data
@ToString(exclude = "user")
@Table(name = "professionals")
public class Professional {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String category;

    private String city;
    private String state;

    private Double latitude;
    private Double longitude;

    @Column(nullable = false)
    private int completedJobs = 0;

    @Column(nullable = false)
    private boolean active = true;

    private Instant createdAt = Instant.now();

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Professional other = (Professional) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31;
    }
}

package com.fixfinder.backend.conversation;

import com.fixfinder.backend.shared.error.AuthorizationException;
import com.fixfinder.backend.shared.error.ValidationException;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A two-party thread between a client and a professional, optionally bound to a job.
 *
 * <p>Unread counters, {@code lastMessage*}, the job link and {@code hiddenFor} are maintained by
 * single-statement updates in {@link ConversationRepository}. Those columns are not updatable through
 * the entity, so saving a stale copy cannot write old values back over them.
 */
@Entity
@Getter
@Setter
@DynamicUpdate
@Table(name = "conversations")
public class Conversation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "conversation_participants", joinColumns = @JoinColumn(name = "conversation_id"))
    @OrderColumn(name = "position")
    private List<Participant> participants = new ArrayList<>();

    // written on insert, then only by the single-statement updates in ConversationRepository
    @Column(updatable = false)
    private Long jobId;

    @Column(updatable = false)
    private Long lastMessageId;

    @Column(updatable = false)
    private Instant lastMessageAt;

    @Column(nullable = false, updatable = false)
    private int clientUnread = 0;

    @Column(nullable = false, updatable = false)
    private int professionalUnread = 0;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "conversation_hidden_for", joinColumns = @JoinColumn(name = "conversation_id"))
    @Column(name = "user_id")
    private Set<Long> hiddenFor = new HashSet<>();

    @Column(nullable = false)
    private boolean active = true;

    private Instant createdAt = Instant.now();

    public static Conversation between(Participant first, Participant second, Long jobId) {
        Conversation c = new Conversation();
        c.participants.add(first);
        c.participants.add(second);
        c.jobId = jobId;
        c.checkParticipants();
        return c;
    }

    @PrePersist
    @PreUpdate
    void checkParticipants() {
        if (participants.size() != 2) {
            throw new ValidationException("A conversation has exactly two participants");
        }
        Participant a = participants.get(0);
        Participant b = participants.get(1);
        if (a.getUserId() == null || b.getUserId() == null || a.getUserId().equals(b.getUserId())) {
            throw new ValidationException("Conversation participants must be two distinct users");
        }
        if (a.getRole() == null || a.getRole().complement() != b.getRole()) {
            throw new ValidationException("Conversation participants must be one client and one professional");
        }
    }

    public boolean isParticipant(Long userId) {
        return participant(userId).isPresent();
    }

    public Optional<Participant> participant(Long userId) {
        return participants.stream().filter(p -> p.getUserId().equals(userId)).findFirst();
    }

    public Participant requireParticipant(Long userId) {
        return participant(userId)
                .orElseThrow(() -> new AuthorizationException("Not a participant of this conversation"));
    }

    public Participant counterpartOf(Long userId) {
        requireParticipant(userId);
        return participants.stream()
                .filter(p -> !p.getUserId().equals(userId))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Conversation has no counterpart"));
    }

    public int unreadFor(ParticipantRole role) {
        return switch (role) {
            case CLIENT -> clientUnread;
            case PROFESSIONAL -> professionalUnread;
        };
    }

    public boolean isHiddenFor(Long userId) {
        return hiddenFor.contains(userId);
    }
}

package com.fixfinder.backend.conversation;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Getter
@Setter
@Table(name = "messages", indexes = {
        @Index(name = "idx_messages_conversation_created", columnList = "conversation_id, createdAt")
})
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Column(nullable = false)
    private Long senderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ParticipantRole senderRole;

    @Embedded
    private MessageContent content;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageType messageType = MessageType.TEXT;

    // only markReadFrom flips these after insert
    @Column(name = "is_read", nullable = false, updatable = false)
    private boolean read = false;

    @Column(updatable = false)
    private Instant readAt;

    @Column(name = "is_edited", nullable = false)
    private boolean edited = false;
    private Instant editedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;
    private Instant deletedAt;

    private Long replyTo;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "message_hidden_for", joinColumns = @JoinColumn(name = "message_id"))
    @Column(name = "user_id")
    private Set<Long> hiddenFor = new HashSet<>();

    private Instant createdAt = Instant.now();

    public boolean isSentBy(Long userId) {
        return senderId != null && senderId.equals(userId);
    }
}

package com.fixfinder.backend.notification;

import com.fixfinder.backend.user.User;
import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

@Entity
@Data
@ToString(exclude = "recipient")
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notifications_recipient_created", columnList = "recipient_id, createdAt"),
        @Index(name = "idx_notifications_expires", columnList = "expiresAt")
})
public class Notification {

    public static final int MAX_TITLE = 100;
    public static final int MAX_MESSAGE = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "recipient_id", nullable = false)
    private User recipient;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Column(length = MAX_TITLE, nullable = false)
    private String title;

    @Column(length = MAX_MESSAGE, nullable = false)
    private String message;

    @Embedded
    private NotificationData data = new NotificationData();

    @Column(name = "is_read", nullable = false)
    private boolean read = false;
    private Instant readAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Priority priority = Priority.MEDIUM;

    private Instant expiresAt; // null = keep forever

    @Column(nullable = false)
    private boolean active = true;

    private Instant createdAt = Instant.now();

    public NotificationData getData() {
        if (data == null) {
            data = new NotificationData();
        }
        return data;
    }
}

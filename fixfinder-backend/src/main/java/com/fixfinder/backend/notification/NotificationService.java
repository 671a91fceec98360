package com.fixfinder.backend.notification;

import com.fixfinder.backend.notification.dto.NotificationDto;
import com.fixfinder.backend.notification.dto.NotificationPage;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.realtime.UserChannel;
import com.fixfinder.backend.shared.PageRequests;
import com.fixfinder.backend.shared.PaginatedResponse;
import com.fixfinder.backend.shared.error.NotFoundException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.User;
import com.fixfinder.backend.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

@Service
@Slf4j
public class NotificationService {

    private final NotificationRepository repository;
    private final UserRepository userRepository;
    private final RealtimePublisher publisher;
    private final Duration reminderTtl;

    public NotificationService(
            NotificationRepository repository,
            UserRepository userRepository,
            RealtimePublisher publisher,
            @Value("${app.notifications.reminder-ttl:P7D}") Duration reminderTtl
    ) {
        this.repository = repository;
        this.userRepository = userRepository;
        this.publisher = publisher;
        this.reminderTtl = reminderTtl;
    }

    /**
     * Persists a notification and pushes {@code notification:new} to the recipient's room.
     * The push is best-effort; persistence failures propagate.
     */
    public Notification create(
            Long recipientId,
            NotificationType type,
            String title,
            String message,
            NotificationData data,
            Priority priority,
            Instant expiresAt
    ) {
        if (type == null) {
            throw new ValidationException("Notification type is required");
        }
        if (title == null || title.isBlank() || title.length() > Notification.MAX_TITLE) {
            throw new ValidationException("Notification title must be 1-" + Notification.MAX_TITLE + " characters");
        }
        if (message == null || message.isBlank() || message.length() > Notification.MAX_MESSAGE) {
            throw new ValidationException("Notification message must be 1-" + Notification.MAX_MESSAGE + " characters");
        }
        User recipient = userRepository.findById(recipientId)
                .orElseThrow(() -> new NotFoundException("Recipient not found"));

        Notification n = new Notification();
        n.setRecipient(recipient);
        n.setType(type);
        n.setTitle(title);
        n.setMessage(message);
        n.setData(data != null ? data : new NotificationData());
        n.setPriority(priority != null ? priority : Priority.MEDIUM);
        n.setCreatedAt(Instant.now());
        if (expiresAt == null && type == NotificationType.REMINDER) {
            expiresAt = n.getCreatedAt().plus(reminderTtl);
        }
        n.setExpiresAt(expiresAt);

        Notification saved = repository.save(n);

        publisher.publish(
                new UserChannel(recipientId),
                new RealtimeEvent(RealtimeEvent.NOTIFICATION_NEW, NotificationDto.from(saved))
        );
        return saved;
    }

    /**
     * Used by the engines after their primary write has committed: nothing thrown here may reach the
     * caller.
     */
    public void notifySafely(
            Long recipientId,
            NotificationType type,
            String title,
            String message,
            NotificationData data,
            Priority priority
    ) {
        try {
            create(recipientId, type, title, message, data, priority, null);
        } catch (RuntimeException ex) {
            log.warn("Could not notify user {} ({}): {}", recipientId, type, ex.getMessage(), ex);
        }
    }

    public NotificationPage list(Long recipientId, int page, int limit, boolean unreadOnly) {
        PageRequest pageable = PageRequests.of(page, limit);
        Page<Notification> result = unreadOnly
                ? repository.findByRecipient_IdAndActiveTrueAndReadFalseOrderByCreatedAtDesc(recipientId, pageable)
                : repository.findByRecipient_IdAndActiveTrueOrderByCreatedAtDesc(recipientId, pageable);

        return new NotificationPage(
                PaginatedResponse.of(result, NotificationDto::from),
                unreadCount(recipientId)
        );
    }

    public long unreadCount(Long recipientId) {
        return repository.countByRecipient_IdAndActiveTrueAndReadFalse(recipientId);
    }

    public NotificationDto markRead(Long id, Long recipientId) {
        Notification n = owned(id, recipientId);
        if (!n.isRead()) {
            n.setRead(true);
            n.setReadAt(Instant.now());
            n = repository.save(n);
        }
        return NotificationDto.from(n);
    }

    public int markAllRead(Long recipientId) {
        return repository.markAllRead(recipientId, Instant.now());
    }

    public void delete(Long id, Long recipientId) {
        Notification n = owned(id, recipientId);
        if (n.isActive()) {
            n.setActive(false);
            repository.save(n);
        }
    }

    public int purgeExpired(Instant now) {
        return repository.deleteExpired(now);
    }

    private Notification owned(Long id, Long recipientId) {
        return repository.findByIdAndRecipient_Id(id, recipientId)
                .orElseThrow(() -> new NotFoundException("Notification not found"));
    }
}

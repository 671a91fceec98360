package com.fixfinder.backend.notification.dto;

import com.fixfinder.backend.notification.Notification;
import com.fixfinder.backend.notification.NotificationData;
import com.fixfinder.backend.notification.NotificationType;
import com.fixfinder.backend.notification.Priority;

import java.time.Instant;

public record NotificationDto(
        Long id,
        NotificationType type,
        String title,
        String message,
        NotificationData data,
        boolean read,
        Instant readAt,
        Priority priority,
        Instant expiresAt,
        Instant createdAt
) {
    public static NotificationDto from(Notification n) {
        return new NotificationDto(
                n.getId(),
                n.getType(),
                n.getTitle(),
                n.getMessage(),
                n.getData(),
                n.isRead(),
                n.getReadAt(),
                n.getPriority(),
                n.getExpiresAt(),
                n.getCreatedAt()
        );
    }
}

package com.fixfinder.backend.notification.dto;

import com.fixfinder.backend.shared.PaginatedResponse;

public record NotificationPage(PaginatedResponse<NotificationDto> notifications, long unreadCount) {
}

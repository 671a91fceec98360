package com.fixfinder.backend.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationExpiryTask {

    private final NotificationService notificationService;

    @Scheduled(cron = "${app.notifications.expiry-cron:0 */15 * * * *}")
    public void purgeExpired() {
        int removed = notificationService.purgeExpired(Instant.now());
        if (removed > 0) {
            log.info("Purged {} expired notifications", removed);
        }
    }
}

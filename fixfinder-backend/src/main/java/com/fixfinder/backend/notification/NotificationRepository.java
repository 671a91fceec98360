package com.fixfinder.backend.notification;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

    Page<Notification> findByRecipient_IdAndActiveTrueOrderByCreatedAtDesc(Long recipientId, Pageable pageable);

    Page<Notification> findByRecipient_IdAndActiveTrueAndReadFalseOrderByCreatedAtDesc(Long recipientId, Pageable pageable);

    long countByRecipient_IdAndActiveTrueAndReadFalse(Long recipientId);

    Optional<Notification> findByIdAndRecipient_Id(Long id, Long recipientId);

    @Transactional
    @Modifying
    @Query("""
    UPDATE Notification n
    SET n.read = true, n.readAt = :now
    WHERE n.recipient.id = :recipientId
      AND n.read = false
      AND n.active = true
    """)
    int markAllRead(@Param("recipientId") Long recipientId, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("DELETE FROM Notification n WHERE n.expiresAt IS NOT NULL AND n.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}

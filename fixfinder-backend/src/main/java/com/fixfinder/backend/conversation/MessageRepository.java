package com.fixfinder.backend.conversation;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface MessageRepository extends JpaRepository<Message, Long> {

    /** Newest first; callers reverse a page for display. */
    @Query("""
    SELECT m FROM Message m
    WHERE m.conversationId = :conversationId
      AND m.deleted = false
      AND :viewerId NOT MEMBER OF m.hiddenFor
    ORDER BY m.createdAt DESC, m.id DESC
    """)
    Page<Message> findVisible(
            @Param("conversationId") Long conversationId,
            @Param("viewerId") Long viewerId,
            Pageable pageable
    );

    @Transactional
    @Modifying
    @Query("""
    UPDATE Message m
    SET m.read = true, m.readAt = :now
    WHERE m.conversationId = :conversationId
      AND m.senderId = :senderId
      AND m.read = false
    """)
    int markReadFrom(
            @Param("conversationId") Long conversationId,
            @Param("senderId") Long senderId,
            @Param("now") Instant now
    );

    @Transactional
    @Modifying
    @Query("""
    UPDATE Message m
    SET m.content.text = :text, m.edited = true, m.editedAt = :at
    WHERE m.id = :id
      AND m.deleted = false
    """)
    int applyEdit(@Param("id") Long id, @Param("text") String text, @Param("at") Instant at);

    @Transactional
    @Modifying
    @Query("""
    UPDATE Message m
    SET m.deleted = true, m.deletedAt = :now
    WHERE m.id = :id
      AND m.deleted = false
    """)
    int softDelete(@Param("id") Long id, @Param("now") Instant now);

    /** Adds the viewer to hiddenFor of every message in the conversation that does not have it yet. */
    @Transactional
    @Modifying
    @Query(value = """
    INSERT INTO message_hidden_for (message_id, user_id)
    SELECT m.id, CAST(:viewerId AS BIGINT)
    FROM messages m
    WHERE m.conversation_id = :conversationId
      AND NOT EXISTS (
          SELECT 1 FROM message_hidden_for h WHERE h.message_id = m.id AND h.user_id = :viewerId
      )
    """, nativeQuery = true)
    int hideAllFor(@Param("conversationId") Long conversationId, @Param("viewerId") Long viewerId);

    @Transactional
    @Modifying
    @Query("""
    UPDATE Message m
    SET m.deleted = true, m.deletedAt = :now
    WHERE m.conversationId = :conversationId
      AND m.senderId = :senderId
      AND m.deleted = false
    """)
    int softDeleteBySender(
            @Param("conversationId") Long conversationId,
            @Param("senderId") Long senderId,
            @Param("now") Instant now
    );
}

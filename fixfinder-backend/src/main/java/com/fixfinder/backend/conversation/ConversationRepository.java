package com.fixfinder.backend.conversation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    @Query("""
    SELECT c FROM Conversation c
    JOIN c.participants pa
    JOIN c.participants pb
    WHERE c.active = true
      AND pa.userId = :userA
      AND pb.userId = :userB
    ORDER BY c.createdAt ASC
    """)
    List<Conversation> findActiveBetween(@Param("userA") Long userA, @Param("userB") Long userB);

    @Query("""
    SELECT c FROM Conversation c
    JOIN c.participants p
    WHERE c.active = true
      AND p.userId = :userId
      AND :userId NOT MEMBER OF c.hiddenFor
    ORDER BY COALESCE(c.lastMessageAt, c.createdAt) DESC
    """)
    List<Conversation> findVisibleFor(@Param("userId") Long userId);

    // Counter bumps are single statements so concurrent sends never lose an increment
    @Transactional
    @Modifying
    @Query("""
    UPDATE Conversation c
    SET c.lastMessageId = :messageId, c.lastMessageAt = :at, c.clientUnread = c.clientUnread + 1
    WHERE c.id = :id
    """)
    int recordMessageToClient(@Param("id") Long id, @Param("messageId") Long messageId, @Param("at") Instant at);

    @Transactional
    @Modifying
    @Query("""
    UPDATE Conversation c
    SET c.lastMessageId = :messageId, c.lastMessageAt = :at, c.professionalUnread = c.professionalUnread + 1
    WHERE c.id = :id
    """)
    int recordMessageToProfessional(@Param("id") Long id, @Param("messageId") Long messageId, @Param("at") Instant at);

    @Transactional
    @Modifying
    @Query("UPDATE Conversation c SET c.clientUnread = 0 WHERE c.id = :id")
    int resetClientUnread(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query("UPDATE Conversation c SET c.professionalUnread = 0 WHERE c.id = :id")
    int resetProfessionalUnread(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query(value = "DELETE FROM conversation_hidden_for WHERE conversation_id = :id", nativeQuery = true)
    int clearHiddenFor(@Param("id") Long id);

    /** Returns 0 when the user already had the conversation hidden. */
    @Transactional
    @Modifying
    @Query(value = """
    INSERT INTO conversation_hidden_for (conversation_id, user_id)
    SELECT CAST(:id AS BIGINT), CAST(:userId AS BIGINT)
    WHERE NOT EXISTS (
        SELECT 1 FROM conversation_hidden_for h WHERE h.conversation_id = :id AND h.user_id = :userId
    )
    """, nativeQuery = true)
    int addHiddenFor(@Param("id") Long id, @Param("userId") Long userId);

    @Transactional
    @Modifying
    @Query("UPDATE Conversation c SET c.jobId = :jobId WHERE c.id = :id")
    int attachJob(@Param("id") Long id, @Param("jobId") Long jobId);

    @Transactional
    @Modifying
    @Query("UPDATE Conversation c SET c.jobId = null WHERE c.id = :id AND c.jobId = :jobId")
    int detachJob(@Param("id") Long id, @Param("jobId") Long jobId);
}

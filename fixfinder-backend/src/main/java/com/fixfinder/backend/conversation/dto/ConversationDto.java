package com.fixfinder.backend.conversation.dto;

import com.fixfinder.backend.conversation.Conversation;
import com.fixfinder.backend.conversation.Participant;
import com.fixfinder.backend.conversation.ParticipantRole;
import com.fixfinder.backend.user.User;

import java.time.Instant;
import java.util.List;

/**
 * A conversation as seen by one of its participants: {@code unreadCount} and {@code otherParticipant}
 * are relative to the viewer.
 */
public record ConversationDto(
        Long id,
        List<Participant> participants,
        OtherParticipant otherParticipant,
        Long jobId,
        Long lastMessageId,
        Instant lastMessageAt,
        int unreadCount,
        Instant createdAt
) {
    public record OtherParticipant(Long userId, ParticipantRole role, String name, boolean online, Instant lastSeen) {
    }

    public static ConversationDto of(Conversation c, Long viewerId, User other) {
        ParticipantRole viewerRole = c.requireParticipant(viewerId).getRole();
        Participant counterpart = c.counterpartOf(viewerId);
        OtherParticipant otherParticipant = new OtherParticipant(
                counterpart.getUserId(),
                counterpart.getRole(),
                other != null ? other.getName() : null,
                other != null && other.getPresence().isOnline(),
                other != null ? other.getPresence().getLastSeen() : null
        );
        return new ConversationDto(
                c.getId(),
                List.copyOf(c.getParticipants()),
                otherParticipant,
                c.getJobId(),
                c.getLastMessageId(),
                c.getLastMessageAt(),
                c.unreadFor(viewerRole),
                c.getCreatedAt()
        );
    }
}

package com.fixfinder.backend.conversation.dto;

import com.fixfinder.backend.conversation.Message;
import com.fixfinder.backend.conversation.MessageContent;
import com.fixfinder.backend.conversation.MessageType;
import com.fixfinder.backend.conversation.ParticipantRole;

import java.time.Instant;

public record MessageDto(
        Long id,
        Long conversationId,
        Long senderId,
        ParticipantRole senderRole,
        MessageType messageType,
        MessageContent content,
        boolean read,
        Instant readAt,
        boolean edited,
        Instant editedAt,
        Long replyTo,
        Instant createdAt
) {
    public static MessageDto from(Message m) {
        return new MessageDto(
                m.getId(),
                m.getConversationId(),
                m.getSenderId(),
                m.getSenderRole(),
                m.getMessageType(),
                m.getContent(),
                m.isRead(),
                m.getReadAt(),
                m.isEdited(),
                m.getEditedAt(),
                m.getReplyTo(),
                m.getCreatedAt()
        );
    }
}

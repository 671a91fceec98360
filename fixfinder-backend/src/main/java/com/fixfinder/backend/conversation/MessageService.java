package com.fixfinder.backend.conversation;

import com.fixfinder.backend.conversation.dto.MessageContentRequest;
import com.fixfinder.backend.conversation.dto.MessageDto;
import com.fixfinder.backend.conversation.dto.SendMessageRequest;
import com.fixfinder.backend.notification.NotificationData;
import com.fixfinder.backend.notification.NotificationService;
import com.fixfinder.backend.notification.NotificationType;
import com.fixfinder.backend.notification.Priority;
import com.fixfinder.backend.realtime.ConversationChannel;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.shared.PageRequests;
import com.fixfinder.backend.shared.PaginatedResponse;
import com.fixfinder.backend.shared.error.AuthorizationException;
import com.fixfinder.backend.shared.error.NotFoundException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.PresenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Message store operations. Each method persists first; the notification and the realtime push that
 * follow are best-effort and never undo the write.
 */
@Service
@Slf4j
public class MessageService {

    static final String LOCATION_SHARE_TEXT = "You are now sharing your location.";
    static final String LOCATION_STOPPED_TEXT = "Location sharing stopped.";
    private static final int PREVIEW_LENGTH = 100;

    private final MessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final ConversationService conversationService;
    private final NotificationService notificationService;
    private final PresenceService presenceService;
    private final RealtimePublisher publisher;
    private final Duration editWindow;

    public MessageService(
            MessageRepository messageRepository,
            ConversationRepository conversationRepository,
            ConversationService conversationService,
            NotificationService notificationService,
            PresenceService presenceService,
            RealtimePublisher publisher,
            @Value("${app.messages.edit-window:PT2M}") Duration editWindow
    ) {
        this.messageRepository = messageRepository;
        this.conversationRepository = conversationRepository;
        this.conversationService = conversationService;
        this.notificationService = notificationService;
        this.presenceService = presenceService;
        this.publisher = publisher;
        this.editWindow = editWindow;
    }

    public MessageDto sendMessage(Long conversationId, Long senderId, SendMessageRequest request) {
        Conversation conversation = conversationService.requireParticipant(conversationId, senderId);

        MessageType type = request.messageType() != null ? request.messageType() : MessageType.TEXT;
        if (!type.isClientSendable()) {
            throw new ValidationException(type + " messages cannot be sent by users");
        }
        if (request.content() == null) {
            throw new ValidationException("Message content is required");
        }
        MessageContent content = request.content().toContent(type);

        if (request.replyTo() != null) {
            Message parent = messageRepository.findById(request.replyTo())
                    .orElseThrow(() -> new NotFoundException("Replied-to message not found"));
            if (!parent.getConversationId().equals(conversationId)) {
                throw new ValidationException("Replies must stay within the same conversation");
            }
        }

        return deliver(conversation, senderId, type, content, request.replyTo());
    }

    public MessageDto shareLocation(Long conversationId, Long senderId, double lat, double lng, Double accuracy) {
        Conversation conversation = conversationService.requireParticipant(conversationId, senderId);
        MessageContentRequest request = new MessageContentRequest(
                null,
                new MessageContentRequest.Location(lat, lng, accuracy, LOCATION_SHARE_TEXT, null),
                null
        );
        return deliver(conversation, senderId, MessageType.LOCATION_SHARE, request.toContent(MessageType.LOCATION_SHARE), null);
    }

    public MessageDto stopLocationShare(Long conversationId, Long senderId) {
        Conversation conversation = conversationService.requireParticipant(conversationId, senderId);
        return deliver(conversation, senderId, MessageType.SYSTEM, MessageContent.text(LOCATION_STOPPED_TEXT), null);
    }

    private MessageDto deliver(Conversation conversation, Long senderId, MessageType type, MessageContent content, Long replyTo) {
        Participant sender = conversation.requireParticipant(senderId);
        Participant recipient = conversation.counterpartOf(senderId);

        Message message = new Message();
        message.setConversationId(conversation.getId());
        message.setSenderId(senderId);
        message.setSenderRole(sender.getRole());
        message.setMessageType(type);
        message.setContent(content);
        message.setReplyTo(replyTo);
        message.setCreatedAt(Instant.now());
        Message saved = messageRepository.save(message);

        switch (recipient.getRole()) {
            case CLIENT -> conversationRepository.recordMessageToClient(conversation.getId(), saved.getId(), saved.getCreatedAt());
            case PROFESSIONAL -> conversationRepository.recordMessageToProfessional(conversation.getId(), saved.getId(), saved.getCreatedAt());
        }
        if (!conversation.getHiddenFor().isEmpty()) {
            conversationRepository.clearHiddenFor(conversation.getId());
        }
        log.debug("Message {} stored in conversation {}", saved.getId(), conversation.getId());

        notificationService.notifySafely(
                recipient.getUserId(),
                NotificationType.NEW_MESSAGE,
                "New message from " + presenceService.displayName(senderId),
                preview(type, content),
                NotificationData.forMessage(conversation.getId(), saved.getId()),
                Priority.MEDIUM
        );

        MessageDto dto = MessageDto.from(saved);
        publisher.publish(new ConversationChannel(conversation.getId()), new RealtimeEvent(RealtimeEvent.NEW_MESSAGE, dto));
        return dto;
    }

    public MessageDto editMessage(Long messageId, Long actorId, String newText) {
        Message message = requireLiveMessage(messageId);
        if (!message.isSentBy(actorId)) {
            throw new AuthorizationException("Only the sender can edit a message");
        }
        if (message.getMessageType() != MessageType.TEXT) {
            throw new ValidationException("Only text messages can be edited");
        }
        Instant now = Instant.now();
        if (Duration.between(message.getCreatedAt(), now).compareTo(editWindow) > 0) {
            throw new ValidationException("Messages can only be edited within " + editWindow.toMinutes() + " minutes");
        }

        String text = MessageContentRequest.checkedText(newText);
        if (messageRepository.applyEdit(messageId, text, now) == 0) {
            throw new NotFoundException("Message not found");
        }
        message.setContent(MessageContent.text(text));
        message.setEdited(true);
        message.setEditedAt(now);

        MessageDto dto = MessageDto.from(message);
        publisher.publish(new ConversationChannel(message.getConversationId()), new RealtimeEvent(RealtimeEvent.MESSAGE_EDITED, dto));
        return dto;
    }

    public void deleteMessage(Long messageId, Long actorId) {
        Message message = messageRepository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message not found"));
        if (!message.isSentBy(actorId)) {
            throw new AuthorizationException("Only the sender can delete a message");
        }
        if (message.isDeleted()) {
            return;
        }
        Instant now = Instant.now();
        if (messageRepository.softDelete(messageId, now) == 0) {
            return; // deleted concurrently
        }
        message.setDeleted(true);
        message.setDeletedAt(now);

        publisher.publish(
                new ConversationChannel(message.getConversationId()),
                new RealtimeEvent(RealtimeEvent.MESSAGE_DELETED, Map.of(
                        "messageId", message.getId(),
                        "conversationId", message.getConversationId()
                ))
        );
    }

    /**
     * One page of visible messages, newest page first, each page ordered oldest to newest. Reading
     * marks the counterpart's messages read.
     */
    public PaginatedResponse<MessageDto> getMessages(Long conversationId, Long actorId, int page, int limit) {
        Conversation conversation = conversationService.requireParticipant(conversationId, actorId);

        Page<Message> result = messageRepository.findVisible(conversationId, actorId, PageRequests.of(page, limit));
        List<MessageDto> items = new ArrayList<>(result.getContent().stream().map(MessageDto::from).toList());
        Collections.reverse(items);

        markRead(conversation, actorId);
        return new PaginatedResponse<>(items, result.getTotalElements(), result.getNumber() + 1, result.getSize());
    }

    public int markConversationRead(Long conversationId, Long actorId) {
        return markRead(conversationService.requireParticipant(conversationId, actorId), actorId);
    }

    private int markRead(Conversation conversation, Long actorId) {
        Participant reader = conversation.requireParticipant(actorId);
        Participant counterpart = conversation.counterpartOf(actorId);

        int marked = messageRepository.markReadFrom(conversation.getId(), counterpart.getUserId(), Instant.now());
        switch (reader.getRole()) {
            case CLIENT -> conversationRepository.resetClientUnread(conversation.getId());
            case PROFESSIONAL -> conversationRepository.resetProfessionalUnread(conversation.getId());
        }
        return marked;
    }

    /** Soft-deletes the actor's own messages for both participants. */
    public int deleteMyMessagesInConversation(Long actorId, Long conversationId) {
        conversationService.requireParticipant(conversationId, actorId);
        int deleted = messageRepository.softDeleteBySender(conversationId, actorId, Instant.now());
        log.info("User {} deleted {} of their messages in conversation {}", actorId, deleted, conversationId);
        return deleted;
    }

    /** Hides every message in the conversation from the actor only. */
    public int deleteAllMessagesForMe(Long actorId, Long conversationId) {
        conversationService.requireParticipant(conversationId, actorId);
        int hidden = messageRepository.hideAllFor(conversationId, actorId);
        log.info("User {} hid {} messages in conversation {}", actorId, hidden, conversationId);
        return hidden;
    }

    private Message requireLiveMessage(Long messageId) {
        return messageRepository.findById(messageId)
                .filter(m -> !m.isDeleted())
                .orElseThrow(() -> new NotFoundException("Message not found"));
    }

    private static String preview(MessageType type, MessageContent content) {
        return switch (type.branch()) {
            case TEXT -> content.getText().length() > PREVIEW_LENGTH
                    ? content.getText().substring(0, PREVIEW_LENGTH) + "..."
                    : content.getText();
            case LOCATION -> "Shared a location";
            case CONTACT -> "Shared a contact";
        };
    }
}

package com.fixfinder.backend.conversation;

import com.fixfinder.backend.conversation.dto.MessageContentRequest;
import com.fixfinder.backend.conversation.dto.MessageDto;
import com.fixfinder.backend.conversation.dto.SendMessageRequest;
import com.fixfinder.backend.notification.NotificationService;
import com.fixfinder.backend.notification.NotificationType;
import com.fixfinder.backend.realtime.ConversationChannel;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.shared.PaginatedResponse;
import com.fixfinder.backend.shared.error.AuthorizationException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.PresenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MessageServiceTest {

    private static final long CONVERSATION_ID = 10L;
    private static final long CLIENT_ID = 1L;
    private static final long PRO_ID = 2L;

    private MessageRepository messageRepository;
    private ConversationRepository conversationRepository;
    private ConversationService conversationService;
    private NotificationService notificationService;
    private RealtimePublisher publisher;
    private MessageService service;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        messageRepository = mock(MessageRepository.class);
        conversationRepository = mock(ConversationRepository.class);
        conversationService = mock(ConversationService.class);
        notificationService = mock(NotificationService.class);
        PresenceService presenceService = mock(PresenceService.class);
        publisher = mock(RealtimePublisher.class);

        service = new MessageService(messageRepository, conversationRepository, conversationService,
                notificationService, presenceService, publisher, Duration.ofMinutes(2));

        conversation = Conversation.between(
                new Participant(CLIENT_ID, ParticipantRole.CLIENT),
                new Participant(PRO_ID, ParticipantRole.PROFESSIONAL),
                null);
        conversation.setId(CONVERSATION_ID);

        when(conversationService.requireParticipant(CONVERSATION_ID, CLIENT_ID)).thenReturn(conversation);
        when(conversationService.requireParticipant(CONVERSATION_ID, PRO_ID)).thenReturn(conversation);
        when(presenceService.displayName(anyLong())).thenReturn("Cleo");
        when(messageRepository.save(any(Message.class))).thenAnswer(inv -> {
            Message m = inv.getArgument(0);
            if (m.getId() == null) m.setId(500L);
            return m;
        });
    }

    @Test
    void sendIncrementsRecipientUnreadExactlyOnce() {
        MessageDto sent = service.sendMessage(CONVERSATION_ID, CLIENT_ID, text("Hello"));

        verify(conversationRepository, times(1)).recordMessageToProfessional(CONVERSATION_ID, 500L, sent.createdAt());
        verify(conversationRepository, never()).recordMessageToClient(anyLong(), anyLong(), any());
        assertEquals(ParticipantRole.CLIENT, sent.senderRole());
    }

    @Test
    void sendSetsLastMessageAtToMessageTimestamp() {
        MessageDto sent = service.sendMessage(CONVERSATION_ID, PRO_ID, text("On my way"));

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(conversationRepository).recordMessageToClient(eq(CONVERSATION_ID), eq(500L), at.capture());
        assertEquals(sent.createdAt(), at.getValue());
    }

    @Test
    void sendUnhidesConversationForBothParticipants() {
        conversation.getHiddenFor().add(PRO_ID);

        service.sendMessage(CONVERSATION_ID, CLIENT_ID, text("Still there?"));

        verify(conversationRepository).clearHiddenFor(CONVERSATION_ID);
    }

    @Test
    void sendNotifiesRecipientAndPushesToConversationRoom() {
        service.sendMessage(CONVERSATION_ID, CLIENT_ID, text("Hello"));

        verify(notificationService).notifySafely(eq(PRO_ID), eq(NotificationType.NEW_MESSAGE), anyString(), eq("Hello"), any(), any());
        ArgumentCaptor<RealtimeEvent> event = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(publisher).publish(eq(new ConversationChannel(CONVERSATION_ID)), event.capture());
        assertEquals(RealtimeEvent.NEW_MESSAGE, event.getValue().name());
    }

    @Test
    void locationWithOnlyLatitudeIsRejectedBeforePersistence() {
        SendMessageRequest request = new SendMessageRequest(
                MessageType.LOCATION,
                new MessageContentRequest(null, new MessageContentRequest.Location(51.5, null, null, null, null), null),
                null);

        assertThrows(ValidationException.class, () -> service.sendMessage(CONVERSATION_ID, CLIENT_ID, request));
        verify(messageRepository, never()).save(any());
        verifyNoInteractions(notificationService, publisher);
    }

    @Test
    void systemMessagesCannotBeSentByUsers() {
        SendMessageRequest request = new SendMessageRequest(MessageType.SYSTEM, MessageContentRequest.ofText("hi"), null);
        assertThrows(ValidationException.class, () -> service.sendMessage(CONVERSATION_ID, CLIENT_ID, request));
    }

    @Test
    void replyMustStayInSameConversation() {
        Message elsewhere = message(77L, 99L, PRO_ID, Instant.now());
        when(messageRepository.findById(77L)).thenReturn(Optional.of(elsewhere));

        SendMessageRequest request = new SendMessageRequest(MessageType.TEXT, MessageContentRequest.ofText("re"), 77L);
        assertThrows(ValidationException.class, () -> service.sendMessage(CONVERSATION_ID, CLIENT_ID, request));
    }

    @Test
    void senderCanEditWithinWindow() {
        Message m = message(500L, CONVERSATION_ID, CLIENT_ID, Instant.now().minusSeconds(30));
        when(messageRepository.findById(500L)).thenReturn(Optional.of(m));
        when(messageRepository.applyEdit(eq(500L), eq("Hello again"), any())).thenReturn(1);

        MessageDto edited = service.editMessage(500L, CLIENT_ID, "Hello again");

        assertTrue(edited.edited());
        assertNotNull(edited.editedAt());
        assertEquals("Hello again", edited.content().getText());
        verify(messageRepository, never()).save(any());
        verify(publisher).publish(eq(new ConversationChannel(CONVERSATION_ID)), any(RealtimeEvent.class));
    }

    @Test
    void editAfterWindowIsRejected() {
        Message m = message(500L, CONVERSATION_ID, CLIENT_ID, Instant.now().minus(Duration.ofMinutes(3)));
        when(messageRepository.findById(500L)).thenReturn(Optional.of(m));

        assertThrows(ValidationException.class, () -> service.editMessage(500L, CLIENT_ID, "too late"));
        assertFalse(m.isEdited());
        verify(messageRepository, never()).applyEdit(anyLong(), any(), any());
    }

    @Test
    void onlySenderCanEdit() {
        Message m = message(500L, CONVERSATION_ID, CLIENT_ID, Instant.now());
        when(messageRepository.findById(500L)).thenReturn(Optional.of(m));

        assertThrows(AuthorizationException.class, () -> service.editMessage(500L, PRO_ID, "not mine"));
    }

    @Test
    void onlySenderCanDeleteAndDeletingTwiceIsHarmless() {
        Message m = message(500L, CONVERSATION_ID, CLIENT_ID, Instant.now());
        when(messageRepository.findById(500L)).thenReturn(Optional.of(m));
        when(messageRepository.softDelete(eq(500L), any())).thenReturn(1);

        assertThrows(AuthorizationException.class, () -> service.deleteMessage(500L, PRO_ID));

        service.deleteMessage(500L, CLIENT_ID);
        service.deleteMessage(500L, CLIENT_ID);

        assertTrue(m.isDeleted());
        verify(messageRepository, times(1)).softDelete(eq(500L), any());
        verify(messageRepository, never()).save(any());
    }

    @Test
    void getMessagesReturnsOldestFirstAndMarksCounterpartRead() {
        Instant base = Instant.parse("2024-05-01T10:00:00Z");
        List<Message> newestFirst = List.of(
                message(3L, CONVERSATION_ID, PRO_ID, base.plusSeconds(20)),
                message(2L, CONVERSATION_ID, CLIENT_ID, base.plusSeconds(10)),
                message(1L, CONVERSATION_ID, PRO_ID, base));
        when(messageRepository.findVisible(eq(CONVERSATION_ID), eq(CLIENT_ID), any()))
                .thenReturn(new PageImpl<>(newestFirst, PageRequest.of(0, 50), 3));

        PaginatedResponse<MessageDto> page = service.getMessages(CONVERSATION_ID, CLIENT_ID, 1, 50);

        assertEquals(List.of(1L, 2L, 3L), page.getItems().stream().map(MessageDto::id).toList());
        assertEquals(3, page.getTotalItems());
        verify(messageRepository).markReadFrom(eq(CONVERSATION_ID), eq(PRO_ID), any());
        verify(conversationRepository).resetClientUnread(CONVERSATION_ID);
        verify(conversationRepository, never()).resetProfessionalUnread(anyLong());
    }

    @Test
    void deleteAllForMeHidesInPlaceWithoutRewritingMessages() {
        when(messageRepository.hideAllFor(CONVERSATION_ID, CLIENT_ID)).thenReturn(1);

        assertEquals(1, service.deleteAllMessagesForMe(CLIENT_ID, CONVERSATION_ID));
        verify(messageRepository, never()).saveAll(any());
        verify(messageRepository, never()).softDeleteBySender(anyLong(), anyLong(), any());
    }


    @Test
    void deleteMyMessagesSoftDeletesForEveryone() {
        when(messageRepository.softDeleteBySender(eq(CONVERSATION_ID), eq(CLIENT_ID), any())).thenReturn(4);

        assertEquals(4, service.deleteMyMessagesInConversation(CLIENT_ID, CONVERSATION_ID));
    }

    @Test
    void locationSharingPersistsShareAndStopMessages() {
        MessageDto share = service.shareLocation(CONVERSATION_ID, PRO_ID, 40.7, -74.0, 12.0);
        assertEquals(MessageType.LOCATION_SHARE, share.messageType());
        assertEquals(40.7, share.content().getLatitude());
        assertEquals(MessageService.LOCATION_SHARE_TEXT, share.content().getLabel());

        MessageDto stop = service.stopLocationShare(CONVERSATION_ID, PRO_ID);
        assertEquals(MessageType.SYSTEM, stop.messageType());
        assertEquals(MessageService.LOCATION_STOPPED_TEXT, stop.content().getText());
    }

    private static SendMessageRequest text(String body) {
        return new SendMessageRequest(MessageType.TEXT, MessageContentRequest.ofText(body), null);
    }

    private static Message message(long id, long conversationId, long senderId, Instant createdAt) {
        Message m = new Message();
        m.setId(id);
        m.setConversationId(conversationId);
        m.setSenderId(senderId);
        m.setSenderRole(senderId == CLIENT_ID ? ParticipantRole.CLIENT : ParticipantRole.PROFESSIONAL);
        m.setMessageType(MessageType.TEXT);
        m.setContent(MessageContent.text("message " + id));
        m.setCreatedAt(createdAt);
        return m;
    }
}

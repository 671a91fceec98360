package com.fixfinder.backend.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketRealtimePublisherTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RoomRegistry rooms;
    private WebSocketRealtimePublisher publisher;

    @BeforeEach
    void setUp() {
        rooms = new RoomRegistry();
        publisher = new WebSocketRealtimePublisher(rooms, objectMapper);
    }

    @Test
    void framesCarryEventNameAndData() throws Exception {
        WebSocketSession s = session("a");
        rooms.register(s);
        rooms.join(new UserChannel(1L).key(), s);

        publisher.publish(new UserChannel(1L), new RealtimeEvent(RealtimeEvent.JOB_UPDATE, Map.of("conversationId", 5)));

        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(s).sendMessage(frame.capture());
        JsonNode json = objectMapper.readTree(frame.getValue().getPayload());
        assertEquals("job:update", json.get("event").asText());
        assertEquals(5, json.get("data").get("conversationId").asInt());
    }

    @Test
    void senderIsExcludedFromRelay() throws Exception {
        WebSocketSession sender = session("a");
        WebSocketSession peer = session("b");
        String room = new ConversationChannel(5L).key();
        rooms.register(sender);
        rooms.register(peer);
        rooms.join(room, sender);
        rooms.join(room, peer);

        publisher.publishExcept(new ConversationChannel(5L), new RealtimeEvent(RealtimeEvent.TYPING, Map.of()), "a");

        verify(sender, never()).sendMessage(any());
        verify(peer).sendMessage(any(TextMessage.class));
    }

    @Test
    void failedSessionIsDroppedAndOthersStillReceive() throws Exception {
        WebSocketSession broken = session("a");
        WebSocketSession healthy = session("b");
        doThrow(new IOException("reset")).when(broken).sendMessage(any());
        rooms.register(broken);
        rooms.register(healthy);
        rooms.join("user:1", broken);
        rooms.join("user:1", healthy);

        publisher.publish(new UserChannel(1L), new RealtimeEvent(RealtimeEvent.NOTIFICATION_NEW, Map.of()));

        verify(healthy).sendMessage(any(TextMessage.class));
        assertEquals(1, rooms.size("user:1"));
        assertNull(rooms.session("a"));
        verify(broken).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    void broadcastReachesEverySession() throws Exception {
        WebSocketSession a = session("a");
        WebSocketSession b = session("b");
        rooms.register(a);
        rooms.register(b);

        publisher.broadcast(new RealtimeEvent(RealtimeEvent.PRESENCE_UPDATE, new PresenceUpdate(1L, true, null)));

        ArgumentCaptor<TextMessage> frame = ArgumentCaptor.forClass(TextMessage.class);
        verify(a).sendMessage(frame.capture());
        verify(b).sendMessage(any(TextMessage.class));
        JsonNode data = objectMapper.readTree(frame.getValue().getPayload()).get("data");
        assertTrue(data.get("isOnline").asBoolean());
        assertFalse(data.has("lastSeen"));
    }

    private static WebSocketSession session(String id) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.isOpen()).thenReturn(true);
        return s;
    }
}

package com.fixfinder.backend.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfinder.backend.shared.error.ExternalServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

@Component("webSocketRealtimePublisher")
@RequiredArgsConstructor
@Slf4j
public class WebSocketRealtimePublisher implements RealtimePublisher {

    private final RoomRegistry rooms;
    private final ObjectMapper objectMapper;

    @Override
    public void publish(Channel channel, RealtimeEvent event) {
        send(rooms.members(channel.key()), event, null);
    }

    @Override
    public void publishExcept(Channel channel, RealtimeEvent event, String excludedSessionId) {
        send(rooms.members(channel.key()), event, excludedSessionId);
    }

    @Override
    public void broadcast(RealtimeEvent event) {
        send(rooms.allSessions(), event, null);
    }

    TextMessage encode(RealtimeEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("event", event.name());
        frame.put("data", event.data());
        try {
            return new TextMessage(objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Could not encode realtime event " + event.name(), e);
        }
    }

    private void send(Collection<WebSocketSession> targets, RealtimeEvent event, String excludedSessionId) {
        if (targets.isEmpty()) return;

        TextMessage frame = encode(event);
        for (WebSocketSession session : targets) {
            if (session.getId().equals(excludedSessionId)) continue;
            if (!session.isOpen()) {
                rooms.leaveAll(session.getId());
                continue;
            }
            try {
                session.sendMessage(frame);
            } catch (IOException | RuntimeException e) {
                log.debug("Send of {} to session {} failed: {}", event.name(), session.getId(), e.getMessage());
                rooms.leaveAll(session.getId());
                close(session);
            }
        }
    }

    // the client reconnects and re-fetches what it missed
    private void close(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not close session {}: {}", session.getId(), e.getMessage());
        }
    }
}

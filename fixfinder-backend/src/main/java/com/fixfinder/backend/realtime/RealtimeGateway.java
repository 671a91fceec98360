package com.fixfinder.backend.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fixfinder.backend.conversation.ConversationService;
import com.fixfinder.backend.user.Presence;
import com.fixfinder.backend.user.PresenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Server side of {@code /ws}. Frames are JSON {@code {"event": ..., "data": ...}} in both directions.
 *
 * <p>Inbound commands: {@code join}, {@code leave}, {@code typing}, {@code message_read},
 * {@code shareLocation}, {@code updateLocation}, {@code stopLocationShare}. Everything relayed here is
 * ephemeral: nothing is written to the message store.
 */
@Component
@Slf4j
public class RealtimeGateway extends TextWebSocketHandler {

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final RoomRegistry rooms;
    private final RealtimePublisher publisher;
    private final PresenceService presenceService;
    private final ConversationService conversationService;
    private final LiveLocationTracker liveLocations;
    private final ObjectMapper objectMapper;

    public RealtimeGateway(
            RoomRegistry rooms,
            RealtimePublisher publisher,
            PresenceService presenceService,
            ConversationService conversationService,
            LiveLocationTracker liveLocations,
            ObjectMapper objectMapper
    ) {
        this.rooms = rooms;
        this.publisher = publisher;
        this.presenceService = presenceService;
        this.conversationService = conversationService;
        this.liveLocations = liveLocations;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        Long userId = userId(session);
        if (userId == null) {
            // handshake interceptor should have refused this upgrade
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        String userRoom = new UserChannel(userId).key();
        boolean firstSession = rooms.size(userRoom) == 0;

        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        rooms.register(safe);
        rooms.join(userRoom, safe);
        log.info("User {} connected (session {})", userId, session.getId());

        if (firstSession) {
            try {
                presenceService.markOnline(userId);
            } catch (RuntimeException ex) {
                log.warn("Could not mark user {} online: {}", userId, ex.getMessage(), ex);
            }
            publisher.broadcast(new RealtimeEvent(RealtimeEvent.PRESENCE_UPDATE, new PresenceUpdate(userId, true, null)));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Long userId = userId(session);
        if (userId == null) return;

        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            sendError(session, "malformed_frame");
            return;
        }
        String event = root.path("event").asText("");
        JsonNode data = root.path("data");

        try {
            switch (event) {
                case "join" -> join(session, userId, data);
                case "leave" -> leave(session, data);
                case "typing" -> relay(session, userId, data, RealtimeEvent.TYPING);
                case "message_read" -> relay(session, userId, data, RealtimeEvent.MESSAGE_READ);
                case "shareLocation" -> shareLocation(session, userId, data);
                case "updateLocation" -> updateLocation(session, userId, data);
                case "stopLocationShare" -> stopLocationShare(session, userId, data);
                default -> sendError(session, "unknown_event");
            }
        } catch (ResponseStatusException ex) {
            sendError(session, ex.getReason());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        rooms.leaveAll(session.getId());
        Long userId = userId(session);
        if (userId == null) return;

        log.info("User {} disconnected (session {}, {})", userId, session.getId(), status);
        if (rooms.size(new UserChannel(userId).key()) > 0) {
            return; // other tabs still open
        }

        Instant lastSeen = Instant.now();
        try {
            lastSeen = presenceService.markOffline(userId)
                    .map(Presence::getLastSeen)
                    .orElse(lastSeen);
        } catch (RuntimeException ex) {
            log.warn("Could not mark user {} offline: {}", userId, ex.getMessage(), ex);
        }
        publisher.broadcast(new RealtimeEvent(RealtimeEvent.PRESENCE_UPDATE, new PresenceUpdate(userId, false, lastSeen)));

        for (Long conversationId : liveLocations.stopAll(userId)) {
            publisher.publish(
                    new ConversationChannel(conversationId),
                    new RealtimeEvent(RealtimeEvent.LOCATION_STOPPED, LocationEvent.stopped(conversationId, userId))
            );
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private void join(WebSocketSession session, Long userId, JsonNode data) {
        Long conversationId = conversationId(data);
        if (conversationId == null) {
            sendError(session, "conversation_required");
            return;
        }
        conversationService.requireParticipant(conversationId, userId);
        WebSocketSession registered = rooms.session(session.getId());
        if (registered == null) return;
        rooms.join(new ConversationChannel(conversationId).key(), registered);
        log.debug("User {} joined conversation {}", userId, conversationId);
    }

    private void leave(WebSocketSession session, JsonNode data) {
        Long conversationId = conversationId(data);
        if (conversationId == null) return;
        rooms.leave(new ConversationChannel(conversationId).key(), session.getId());
    }

    private void relay(WebSocketSession session, Long userId, JsonNode data, String eventName) {
        Long conversationId = joinedConversation(session, data);
        if (conversationId == null) return;

        ObjectNode payload = data.isObject() ? ((ObjectNode) data).deepCopy() : objectMapper.createObjectNode();
        payload.put("conversationId", conversationId);
        payload.put("userId", userId);
        publisher.publishExcept(new ConversationChannel(conversationId), new RealtimeEvent(eventName, payload), session.getId());
        log.debug("Relayed {} from user {} to conversation {}", eventName, userId, conversationId);
    }

    private void shareLocation(WebSocketSession session, Long userId, JsonNode data) {
        Long conversationId = joinedConversation(session, data);
        if (conversationId == null) return;
        if (!hasCoordinates(data)) {
            sendError(session, "location_required");
            return;
        }

        String userName = presenceService.displayName(userId);
        liveLocations.start(userId, conversationId);
        publisher.publishExcept(
                new ConversationChannel(conversationId),
                new RealtimeEvent(RealtimeEvent.LOCATION_SHARED, locationEvent(conversationId, userId, userName, data)),
                session.getId()
        );
    }

    private void updateLocation(WebSocketSession session, Long userId, JsonNode data) {
        Long conversationId = joinedConversation(session, data);
        if (conversationId == null) return;
        if (!hasCoordinates(data)) {
            sendError(session, "location_required");
            return;
        }

        liveLocations.start(userId, conversationId);
        publisher.publishExcept(
                new ConversationChannel(conversationId),
                new RealtimeEvent(RealtimeEvent.LOCATION_UPDATED, locationEvent(conversationId, userId, null, data)),
                session.getId()
        );
    }

    private void stopLocationShare(WebSocketSession session, Long userId, JsonNode data) {
        Long conversationId = joinedConversation(session, data);
        if (conversationId == null) return;

        liveLocations.stop(userId, conversationId);
        publisher.publishExcept(
                new ConversationChannel(conversationId),
                new RealtimeEvent(RealtimeEvent.LOCATION_STOPPED, LocationEvent.stopped(conversationId, userId)),
                session.getId()
        );
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /** Conversation id of an ephemeral command, or null (after telling the client) if not joined. */
    private Long joinedConversation(WebSocketSession session, JsonNode data) {
        Long conversationId = conversationId(data);
        if (conversationId == null) {
            sendError(session, "conversation_required");
            return null;
        }
        if (!rooms.isMember(new ConversationChannel(conversationId).key(), session.getId())) {
            sendError(session, "not_joined");
            return null;
        }
        return conversationId;
    }

    // join accepts a bare id as well as {"conversationId": id}
    static Long conversationId(JsonNode data) {
        JsonNode node = data != null && data.isObject() ? data.path("conversationId") : data;
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) return node.asLong();
        if (node.isTextual()) {
            try {
                return Long.valueOf(node.asText().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static boolean hasCoordinates(JsonNode data) {
        return data.path("lat").isNumber() && data.path("lng").isNumber();
    }

    private static LocationEvent locationEvent(Long conversationId, Long userId, String userName, JsonNode data) {
        return new LocationEvent(
                conversationId,
                userId,
                userName,
                data.path("lat").asDouble(),
                data.path("lng").asDouble(),
                data.path("accuracy").isNumber() ? data.path("accuracy").asDouble() : null,
                Instant.now()
        );
    }

    private static Long userId(WebSocketSession session) {
        Object value = session.getAttributes().get(SessionAuthInterceptor.USER_ID);
        return value instanceof Long id ? id : null;
    }

    private void sendError(WebSocketSession session, String reason) {
        WebSocketSession target = rooms.session(session.getId());
        if (target == null || !target.isOpen()) return;
        try {
            Map<String, Object> frame = Map.of(
                    "event", RealtimeEvent.ERROR,
                    "data", Map.of("message", reason != null ? reason : "error")
            );
            target.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException ex) {
            log.debug("Could not send error to session {}: {}", session.getId(), ex.getMessage());
        }
    }
}

package com.fixfinder.backend.realtime;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process room membership. A user may hold several sessions (tabs, devices), each joined to the
 * user's private room and to any conversation rooms it asked for.
 */
@Component
public class RoomRegistry {

    // room key -> sessions
    private final Map<String, CopyOnWriteArrayList<WebSocketSession>> rooms = new ConcurrentHashMap<>();
    // session id -> room keys
    private final Map<String, Set<String>> roomsBySession = new ConcurrentHashMap<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
        roomsBySession.computeIfAbsent(session.getId(), k -> ConcurrentHashMap.newKeySet());
    }

    public WebSocketSession session(String sessionId) {
        return sessions.get(sessionId);
    }

    public void join(String room, WebSocketSession session) {
        CopyOnWriteArrayList<WebSocketSession> members = rooms.computeIfAbsent(room, k -> new CopyOnWriteArrayList<>());
        members.addIfAbsent(session);
        roomsBySession.computeIfAbsent(session.getId(), k -> ConcurrentHashMap.newKeySet()).add(room);
    }

    public void leave(String room, String sessionId) {
        List<WebSocketSession> members = rooms.get(room);
        if (members != null) {
            members.removeIf(s -> s.getId().equals(sessionId));
            if (members.isEmpty()) {
                rooms.remove(room, members);
            }
        }
        Set<String> joined = roomsBySession.get(sessionId);
        if (joined != null) {
            joined.remove(room);
        }
    }

    /** Drops the session from every room it joined and returns those rooms. */
    public Set<String> leaveAll(String sessionId) {
        sessions.remove(sessionId);
        Set<String> joined = roomsBySession.remove(sessionId);
        if (joined == null) {
            return Set.of();
        }
        for (String room : joined) {
            List<WebSocketSession> members = rooms.get(room);
            if (members != null) {
                members.removeIf(s -> s.getId().equals(sessionId));
                if (members.isEmpty()) {
                    rooms.remove(room, members);
                }
            }
        }
        return joined;
    }

    public Collection<WebSocketSession> members(String room) {
        List<WebSocketSession> members = rooms.get(room);
        return members == null ? List.of() : List.copyOf(members);
    }

    public boolean isMember(String room, String sessionId) {
        Set<String> joined = roomsBySession.get(sessionId);
        return joined != null && joined.contains(room);
    }

    public int size(String room) {
        List<WebSocketSession> members = rooms.get(room);
        return members == null ? 0 : members.size();
    }

    public Collection<WebSocketSession> allSessions() {
        return List.copyOf(sessions.values());
    }
}

package com.fixfinder.backend.realtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RoomRegistryTest {

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
    }

    @Test
    void userMayHoldSeveralSessions() {
        WebSocketSession tab1 = session("a");
        WebSocketSession tab2 = session("b");
        registry.register(tab1);
        registry.register(tab2);
        registry.join("user:1", tab1);
        registry.join("user:1", tab2);

        assertEquals(2, registry.size("user:1"));

        registry.leaveAll("a");
        assertEquals(1, registry.size("user:1"));
        assertSame(tab2, registry.members("user:1").iterator().next());
    }

    @Test
    void leaveAllReturnsJoinedRoomsAndForgetsSession() {
        WebSocketSession s = session("a");
        registry.register(s);
        registry.join("user:1", s);
        registry.join("conversation:5", s);

        Set<String> left = registry.leaveAll("a");

        assertEquals(Set.of("user:1", "conversation:5"), left);
        assertNull(registry.session("a"));
        assertEquals(0, registry.size("conversation:5"));
        assertTrue(registry.allSessions().isEmpty());
    }

    @Test
    void joiningTwiceKeepsOneMembership() {
        WebSocketSession s = session("a");
        registry.register(s);
        registry.join("conversation:5", s);
        registry.join("conversation:5", s);

        assertEquals(1, registry.size("conversation:5"));
        assertTrue(registry.isMember("conversation:5", "a"));
    }

    @Test
    void leaveRemovesSingleRoomOnly() {
        WebSocketSession s = session("a");
        registry.register(s);
        registry.join("user:1", s);
        registry.join("conversation:5", s);

        registry.leave("conversation:5", "a");

        assertFalse(registry.isMember("conversation:5", "a"));
        assertTrue(registry.isMember("user:1", "a"));
    }

    @Test
    void unknownRoomHasNoMembers() {
        assertTrue(registry.members("conversation:404").isEmpty());
        assertEquals(Set.of(), registry.leaveAll("nobody"));
    }

    private static WebSocketSession session(String id) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.isOpen()).thenReturn(true);
        return s;
    }
}

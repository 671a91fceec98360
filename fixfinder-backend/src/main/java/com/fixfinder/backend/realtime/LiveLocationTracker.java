package com.fixfinder.backend.realtime;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which users are currently streaming live location into which conversations. Memory only.
 */
@Component
public class LiveLocationTracker {

    private final Map<Long, Set<Long>> sharingByUser = new ConcurrentHashMap<>();

    public void start(Long userId, Long conversationId) {
        sharingByUser.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(conversationId);
    }

    public boolean stop(Long userId, Long conversationId) {
        Set<Long> conversations = sharingByUser.get(userId);
        if (conversations == null) return false;
        boolean removed = conversations.remove(conversationId);
        if (conversations.isEmpty()) {
            sharingByUser.remove(userId, conversations);
        }
        return removed;
    }

    public boolean isSharing(Long userId, Long conversationId) {
        Set<Long> conversations = sharingByUser.get(userId);
        return conversations != null && conversations.contains(conversationId);
    }

    public Set<Long> stopAll(Long userId) {
        Set<Long> conversations = sharingByUser.remove(userId);
        return conversations == null ? Set.of() : Set.copyOf(conversations);
    }
}

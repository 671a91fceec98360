package com.fixfinder.backend.realtime;

public record ConversationChannel(Long conversationId) implements Channel {

    @Override
    public String key() {
        return "conversation:" + conversationId;
    }
}

package com.fixfinder.backend.realtime;

public record UserChannel(Long userId) implements Channel {

    @Override
    public String key() {
        return "user:" + userId;
    }
}

package com.fixfinder.backend.realtime;

/**
 * A pub/sub destination. Two kinds exist: a user's private room and a conversation room.
 */
public interface Channel {

    String key();
}

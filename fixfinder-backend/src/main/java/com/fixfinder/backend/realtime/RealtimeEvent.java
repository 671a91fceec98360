package com.fixfinder.backend.realtime;

/**
 * Named event pushed to clients as {@code {"event": name, "data": data}}.
 */
public record RealtimeEvent(String name, Object data) {

    // durable: always derived from a committed store write
    public static final String JOB_UPDATE = "job:update";
    public static final String NOTIFICATION_NEW = "notification:new";
    public static final String NEW_CONVERSATION = "new_conversation";
    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_EDITED = "message_edited";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String PRESENCE_UPDATE = "presence:update";

    // ephemeral: relayed, never stored
    public static final String TYPING = "typing";
    public static final String MESSAGE_READ = "message_read";
    public static final String LOCATION_SHARED = "locationShared";
    public static final String LOCATION_UPDATED = "locationUpdated";
    public static final String LOCATION_STOPPED = "locationStopped";

    public static final String ERROR = "error";
}

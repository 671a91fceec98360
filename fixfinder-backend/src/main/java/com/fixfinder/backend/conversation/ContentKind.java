package com.fixfinder.backend.conversation;

/** The branches of {@link MessageContent}. */
public enum ContentKind {
    TEXT,
    LOCATION,
    CONTACT
}

package com.fixfinder.backend.conversation;

public enum MessageType {
    TEXT(ContentKind.TEXT, true),
    LOCATION(ContentKind.LOCATION, true),
    CONTACT(ContentKind.CONTACT, true),
    LOCATION_SHARE(ContentKind.LOCATION, true),
    SYSTEM(ContentKind.TEXT, false);

    private final ContentKind branch;
    private final boolean clientSendable;

    MessageType(ContentKind branch, boolean clientSendable) {
        this.branch = branch;
        this.clientSendable = clientSendable;
    }

    /** The one content branch a message of this type carries. */
    public ContentKind branch() {
        return branch;
    }

    public boolean isClientSendable() {
        return clientSendable;
    }
}

package com.fixfinder.backend.conversation.dto;

import com.fixfinder.backend.conversation.ContentKind;
import com.fixfinder.backend.conversation.MessageContent;
import com.fixfinder.backend.conversation.MessageType;
import com.fixfinder.backend.shared.error.ValidationException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Wire form of a message body: {@code {"text": ...}}, {@code {"location": {...}}} or
 * {@code {"contact": {...}}}. Payloads that fill more than one branch are rejected.
 */
public record MessageContentRequest(String text, Location location, Contact contact) {

    public record Location(Double lat, Double lng, Double accuracy, String label, Instant timestamp) {
    }

    public record Contact(String name, String phone, String email) {
    }

    public static MessageContentRequest ofText(String text) {
        return new MessageContentRequest(text, null, null);
    }

    public Set<ContentKind> branches() {
        Set<ContentKind> kinds = EnumSet.noneOf(ContentKind.class);
        if (text != null) kinds.add(ContentKind.TEXT);
        if (location != null) kinds.add(ContentKind.LOCATION);
        if (contact != null) kinds.add(ContentKind.CONTACT);
        return kinds;
    }

    /** Validates this payload against {@code type} and builds the stored content. */
    public MessageContent toContent(MessageType type) {
        Set<ContentKind> branches = branches();
        if (branches.isEmpty()) {
            throw new ValidationException("Message content is required");
        }
        if (branches.size() > 1) {
            throw new ValidationException("Message content must populate exactly one of text, location or contact");
        }
        ContentKind expected = type.branch();
        if (!branches.contains(expected)) {
            throw new ValidationException("A " + type + " message needs " + expected.name().toLowerCase() + " content");
        }

        return switch (expected) {
            case TEXT -> MessageContent.text(checkedText(text));
            case LOCATION -> checkedLocation(location);
            case CONTACT -> checkedContact(contact);
        };
    }

    public static String checkedText(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Message text cannot be empty");
        }
        if (trimmed.length() > MessageContent.MAX_TEXT) {
            throw new ValidationException("Message text cannot exceed " + MessageContent.MAX_TEXT + " characters");
        }
        return trimmed;
    }

    private static MessageContent checkedLocation(Location location) {
        if (location.lat() == null || location.lng() == null) {
            throw new ValidationException("Location messages need both lat and lng");
        }
        if (location.lat() < -90 || location.lat() > 90 || location.lng() < -180 || location.lng() > 180) {
            throw new ValidationException("Location coordinates are out of range");
        }
        Instant at = location.timestamp() != null ? location.timestamp() : Instant.now();
        return MessageContent.location(location.lat(), location.lng(), location.accuracy(), location.label(), at);
    }

    private static MessageContent checkedContact(Contact contact) {
        String name = blankToNull(contact.name());
        String phone = blankToNull(contact.phone());
        String email = blankToNull(contact.email());
        if (name == null && phone == null && email == null) {
            throw new ValidationException("Contact messages need a name, phone or email");
        }
        return MessageContent.contact(name, phone, email);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}

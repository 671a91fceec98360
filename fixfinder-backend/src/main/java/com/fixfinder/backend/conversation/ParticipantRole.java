package com.fixfinder.backend.conversation;

import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.Role;

/**
 * Side of a conversation. Every conversation pairs one CLIENT with one PROFESSIONAL.
 */
public enum ParticipantRole {
    CLIENT,
    PROFESSIONAL;

    public ParticipantRole complement() {
        return switch (this) {
            case CLIENT -> PROFESSIONAL;
            case PROFESSIONAL -> CLIENT;
        };
    }

    public static ParticipantRole of(Role role) {
        if (role == null) {
            throw new ValidationException("User has no role");
        }
        return switch (role) {
            case CLIENT -> CLIENT;
            case PROFESSIONAL -> PROFESSIONAL;
            case ADMIN -> throw new ValidationException("Admins cannot take part in conversations");
        };
    }
}

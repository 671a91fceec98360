package com.fixfinder.backend.conversation.dto;

import jakarta.validation.constraints.NotNull;

public record StartConversationRequest(@NotNull Long participantId, Long jobId) {
}

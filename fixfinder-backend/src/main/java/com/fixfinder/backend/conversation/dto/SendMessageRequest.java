package com.fixfinder.backend.conversation.dto;

import com.fixfinder.backend.conversation.MessageType;
import jakarta.validation.constraints.NotNull;

public record SendMessageRequest(
        MessageType messageType, // defaults to TEXT
        @NotNull MessageContentRequest content,
        Long replyTo
) {
}

package com.fixfinder.backend.conversation.dto;

import jakarta.validation.constraints.NotBlank;

public record EditMessageRequest(@NotBlank String text) {
}

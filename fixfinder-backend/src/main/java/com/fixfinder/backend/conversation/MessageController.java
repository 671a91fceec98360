package com.fixfinder.backend.conversation;

import com.fixfinder.backend.auth.CustomUserDetails;
import com.fixfinder.backend.conversation.dto.*;
import com.fixfinder.backend.shared.PaginatedResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final ConversationService conversationService;
    private final MessageService messageService;

    @GetMapping("/conversations")
    public List<ConversationDto> listConversations(@AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.listConversations(principal.getUser().getId());
    }

    @PostMapping("/conversations")
    public ConversationDto startConversation(
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody StartConversationRequest request
    ) {
        return conversationService.start(principal.getUser().getId(), request.participantId(), request.jobId());
    }

    /**
     * Messages of a conversation. Defaults: page=1, limit=50.
     */
    @GetMapping("/conversations/{id}")
    public PaginatedResponse<MessageDto> getMessages(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "50") int limit
    ) {
        return messageService.getMessages(id, principal.getUser().getId(), page, limit);
    }

    @PostMapping("/conversations/{id}")
    public ResponseEntity<MessageDto> sendMessage(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody SendMessageRequest request
    ) {
        MessageDto sent = messageService.sendMessage(id, principal.getUser().getId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(sent);
    }

    @PutMapping("/{messageId}")
    public MessageDto editMessage(
            @PathVariable Long messageId,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody EditMessageRequest request
    ) {
        return messageService.editMessage(messageId, principal.getUser().getId(), request.text());
    }

    @DeleteMapping("/{messageId}")
    public ResponseEntity<Void> deleteMessage(
            @PathVariable Long messageId,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        messageService.deleteMessage(messageId, principal.getUser().getId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/conversations/{id}/read")
    public Map<String, Integer> markRead(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return Map.of("modified", messageService.markConversationRead(id, principal.getUser().getId()));
    }

    @DeleteMapping("/conversations/{id}/my-messages")
    public Map<String, Integer> deleteMyMessages(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return Map.of("modified", messageService.deleteMyMessagesInConversation(principal.getUser().getId(), id));
    }

    @DeleteMapping("/conversations/{id}/all-for-me")
    public Map<String, Integer> deleteAllForMe(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return Map.of("modified", messageService.deleteAllMessagesForMe(principal.getUser().getId(), id));
    }

    @DeleteMapping("/conversations/{id}/for-me")
    public ResponseEntity<Void> deleteConversationForMe(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        conversationService.deleteConversationForMe(principal.getUser().getId(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/conversations/{id}/location-share")
    public ResponseEntity<MessageDto> shareLocation(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal,
            @Valid @RequestBody LocationShareRequest request
    ) {
        MessageDto sent = messageService.shareLocation(id, principal.getUser().getId(), request.lat(), request.lng(), request.accuracy());
        return ResponseEntity.status(HttpStatus.CREATED).body(sent);
    }

    @PostMapping("/conversations/{id}/stop-location-share")
    public ResponseEntity<MessageDto> stopLocationShare(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        MessageDto sent = messageService.stopLocationShare(id, principal.getUser().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(sent);
    }
}

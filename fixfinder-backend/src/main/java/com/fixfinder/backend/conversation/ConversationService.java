package com.fixfinder.backend.conversation;

import com.fixfinder.backend.conversation.dto.ConversationDto;
import com.fixfinder.backend.realtime.RealtimeEvent;
import com.fixfinder.backend.realtime.RealtimePublisher;
import com.fixfinder.backend.realtime.UserChannel;
import com.fixfinder.backend.shared.error.NotFoundException;
import com.fixfinder.backend.shared.error.ValidationException;
import com.fixfinder.backend.user.User;
import com.fixfinder.backend.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ConversationRepository conversationRepository;
    private final UserRepository userRepository;
    private final RealtimePublisher publisher;

    /**
     * Returns the active conversation between the two users, creating it when none exists. The
     * pair is unordered: (A, B) and (B, A) resolve to the same conversation.
     */
    public Conversation findOrCreate(Long userA, ParticipantRole roleA, Long userB, ParticipantRole roleB, Long jobId) {
        if (userA == null || userB == null || userA.equals(userB)) {
            throw new ValidationException("A conversation needs two distinct users");
        }
        if (roleA == null || roleA.complement() != roleB) {
            throw new ValidationException("A conversation pairs a client with a professional");
        }

        List<Conversation> existing = conversationRepository.findActiveBetween(userA, userB);
        if (!existing.isEmpty()) {
            Conversation found = existing.get(0);
            if (jobId != null && found.getJobId() == null) {
                conversationRepository.attachJob(found.getId(), jobId);
                found.setJobId(jobId);
            }
            return found;
        }

        User b = userRepository.findById(userB).orElseThrow(() -> new NotFoundException("User not found"));
        if (!userRepository.existsById(userA)) {
            throw new NotFoundException("User not found");
        }

        Conversation created = conversationRepository.save(Conversation.between(
                new Participant(userA, roleA),
                new Participant(userB, roleB),
                jobId
        ));
        log.info("Conversation {} opened between users {} and {}", created.getId(), userA, userB);

        User a = userRepository.findById(userA).orElse(null);
        publisher.publish(
                new UserChannel(userB),
                new RealtimeEvent(RealtimeEvent.NEW_CONVERSATION, ConversationDto.of(created, b.getId(), a))
        );
        return created;
    }

    /** Starts (or reopens) a conversation from the acting user's side; roles come from the user store. */
    public ConversationDto start(Long actorId, Long otherUserId, Long jobId) {
        User actor = userRepository.findById(actorId).orElseThrow(() -> new NotFoundException("User not found"));
        User other = userRepository.findById(otherUserId).orElseThrow(() -> new NotFoundException("User not found"));

        Conversation c = findOrCreate(
                actor.getId(), ParticipantRole.of(actor.getRole()),
                other.getId(), ParticipantRole.of(other.getRole()),
                jobId
        );
        return ConversationDto.of(c, actorId, other);
    }

    public List<ConversationDto> listConversations(Long actorId) {
        List<Conversation> conversations = conversationRepository.findVisibleFor(actorId);
        List<Long> otherIds = conversations.stream()
                .map(c -> c.counterpartOf(actorId).getUserId())
                .distinct()
                .toList();
        Map<Long, User> others = userRepository.findAllById(otherIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));

        return conversations.stream()
                .map(c -> ConversationDto.of(c, actorId, others.get(c.counterpartOf(actorId).getUserId())))
                .toList();
    }

    public Conversation requireConversation(Long conversationId) {
        return conversationRepository.findById(conversationId)
                .filter(Conversation::isActive)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }

    public Conversation requireParticipant(Long conversationId, Long userId) {
        Conversation c = requireConversation(conversationId);
        c.requireParticipant(userId);
        return c;
    }

    /** Hides the conversation from the actor's list until the next message arrives. */
    public void deleteConversationForMe(Long actorId, Long conversationId) {
        Conversation c = requireParticipant(conversationId, actorId);
        if (c.isHiddenFor(actorId)) {
            return;
        }
        if (conversationRepository.addHiddenFor(conversationId, actorId) > 0) {
            log.info("Conversation {} hidden for user {}", conversationId, actorId);
        }
    }

    public void attachJob(Long conversationId, Long jobId) {
        conversationRepository.attachJob(conversationId, jobId);
    }

    public void detachJob(Long conversationId, Long jobId) {
        conversationRepository.detachJob(conversationId, jobId);
    }
}

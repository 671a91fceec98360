package com.fixfinder.backend.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PresenceService {

    private final UserRepository userRepository;

    public Optional<Presence> markOnline(Long userId) {
        return userRepository.findById(userId).map(user -> {
            user.getPresence().setOnline(true);
            userRepository.save(user);
            return user.getPresence();
        });
    }

    public Optional<Presence> markOffline(Long userId) {
        return userRepository.findById(userId).map(user -> {
            user.getPresence().setOnline(false);
            user.getPresence().setLastSeen(Instant.now());
            userRepository.save(user);
            log.debug("User {} offline, last seen {}", userId, user.getPresence().getLastSeen());
            return user.getPresence();
        });
    }

    public String displayName(Long userId) {
        return userRepository.findById(userId)
                .map(User::getName)
                .filter(n -> !n.isBlank())
                .orElse("Someone");
    }
}

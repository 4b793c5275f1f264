package com.memehub.engagement.service;

import com.memehub.engagement.dto.UserDTO;
import com.memehub.engagement.entity.AppUser;
import com.memehub.engagement.entity.Rank;
import com.memehub.engagement.exception.InvalidReferenceException;
import com.memehub.engagement.exception.PolicyViolationException;
import com.memehub.engagement.repository.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository userRepository;
    private final Clock clock;

    public UserService(AppUserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Creates the engagement record for an identity-provider user id with
     * zero points. An id that is already registered is returned unchanged.
     */
    @Transactional
    public UserDTO registerUser(Long userId, String displayName) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is required");
        }
        Optional<AppUser> existing = userRepository.findById(userId);
        if (existing.isPresent()) {
            return UserDTO.from(existing.get());
        }
        String name = (displayName == null || displayName.isBlank()) ? "user-" + userId : displayName.trim();
        if (name.length() > AppUser.DISPLAY_NAME_LENGTH) {
            throw new PolicyViolationException(PolicyViolationException.NAME_TOO_LONG,
                    "Display name exceeds " + AppUser.DISPLAY_NAME_LENGTH + " characters");
        }
        AppUser user = new AppUser(userId, name, 0L, Rank.NEWBIE, LocalDateTime.now(clock));
        user = userRepository.saveAndFlush(user);
        log.info("Registered user {} ({})", userId, name);
        return UserDTO.from(user);
    }

    @Transactional(readOnly = true)
    public Optional<UserDTO> findUser(Long userId) {
        return userRepository.findById(userId).map(UserDTO::from);
    }

    @Transactional(readOnly = true)
    public AppUser requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new InvalidReferenceException(InvalidReferenceException.UNKNOWN_USER,
                        "User " + userId + " does not exist"));
    }
}

package com.flagship.bank_ledger.user;

import com.flagship.bank_ledger.exception.DuplicateUsernameException;
import com.flagship.bank_ledger.exception.UserNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Registers and looks up account owners.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final Clock clock;

    /**
     * Registers a new user.
     *
     * @param username unique user name
     * @return the stored user
     * @throws DuplicateUsernameException if the name is already registered
     */
    @Transactional
    public User createUser(String username) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
        User user = new User(UUID.randomUUID(), username.trim(), now);
        try {
            userRepository.insert(user);
        } catch (DuplicateKeyException e) {
            throw new DuplicateUsernameException(user.getUsername());
        }
        log.info("Registered user: userId={}", user.getId());
        return user;
    }

    @Transactional(readOnly = true)
    public User getUser(UUID userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }
}

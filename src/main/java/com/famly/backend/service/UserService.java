package com.famly.backend.service;

import com.famly.backend.exception.DuplicateUsernameException;
import com.famly.backend.exception.UnauthorizedException;
import com.famly.backend.exception.UserNotFoundException;
import com.famly.backend.exception.ValidationException;
import com.famly.backend.model.User;
import com.famly.backend.repository.UserRepository;
import com.famly.backend.util.FamlyKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Accounts: usernames and BCrypt password hashes in the Users table.
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    public static final String DELETED_USER = "DELETED_USER";
    private static final int MAX_USERNAME_LENGTH = 50;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PasswordService passwordService;

    public User create(String username, String password) {
        validateUsername(username);
        if (password == null || password.isEmpty()) {
            throw new ValidationException("Password must be non-empty!");
        }
        if (userRepository.findByUsername(username).isPresent()) {
            throw new DuplicateUsernameException("Username " + username + " is already taken!");
        }

        User user = new User(username, passwordService.hash(password));
        userRepository.save(user);
        logger.info("Created user {}", user.getId());
        return user;
    }

    public User getUserById(String userId) {
        return findById(userId)
            .orElseThrow(() -> new UserNotFoundException("User not found!"));
    }

    public User getUserByUsername(String username) {
        return userRepository.findByUsername(username)
            .orElseThrow(() -> new UserNotFoundException("User " + username + " not found!"));
    }

    public List<User> getUsers() {
        return userRepository.findAll();
    }

    public User authenticate(String username, String password) {
        if (username == null || password == null) {
            throw new UnauthorizedException("Username or password is incorrect.");
        }
        Optional<User> user = userRepository.findByUsername(username);
        if (user.isEmpty() || !passwordService.matches(password, user.get().getPassword())) {
            logger.warn("Failed login attempt for username {}", username);
            throw new UnauthorizedException("Username or password is incorrect.");
        }
        if (passwordService.needsRehash(user.get().getPassword())) {
            user.get().setPassword(passwordService.hash(password));
            userRepository.save(user.get());
            logger.info("Upgraded password hash of user {}", user.get().getId());
        }
        return user.get();
    }

    public String updateUsername(String userId, String newUsername) {
        validateUsername(newUsername);
        User user = getUserById(userId);
        if (newUsername.equals(user.getUsername())) {
            return "Username updated successfully!";
        }
        if (userRepository.findByUsername(newUsername).isPresent()) {
            throw new DuplicateUsernameException("Username " + newUsername + " is already taken!");
        }
        user.setUsername(newUsername);
        userRepository.save(user);
        logger.info("User {} changed username", userId);
        return "Username updated successfully!";
    }

    public String updatePassword(String userId, String currentPassword, String newPassword) {
        User user = getUserById(userId);
        if (currentPassword == null || !passwordService.matches(currentPassword, user.getPassword())) {
            throw new UnauthorizedException("Current password is incorrect");
        }
        if (newPassword == null || newPassword.isEmpty()) {
            throw new ValidationException("Password must be non-empty!");
        }
        user.setPassword(passwordService.hash(newPassword));
        userRepository.save(user);
        logger.info("User {} changed password", userId);
        return "Password updated successfully!";
    }

    public String delete(String userId) {
        User user = getUserById(userId);
        userRepository.delete(user);
        logger.info("Deleted user {}", userId);
        return "User deleted!";
    }

    /**
     * Map each id to its username for response bodies. Ids of deleted accounts map to DELETED_USER.
     */
    public Map<String, String> resolveUsernames(Collection<String> userIds) {
        Map<String, String> usernames = new LinkedHashMap<>();
        for (String userId : userIds) {
            if (userId == null || usernames.containsKey(userId)) {
                continue;
            }
            usernames.put(userId, findById(userId).map(User::getUsername).orElse(DELETED_USER));
        }
        return usernames;
    }

    private Optional<User> findById(String userId) {
        if (!FamlyKeyFactory.isValidId(userId)) {
            return Optional.empty();
        }
        return userRepository.findById(UUID.fromString(userId));
    }

    private void validateUsername(String username) {
        if (username == null || username.trim().isEmpty()) {
            throw new ValidationException("Username must be non-empty!");
        }
        if (username.length() > MAX_USERNAME_LENGTH) {
            throw new ValidationException("Username must be " + MAX_USERNAME_LENGTH + " characters or less");
        }
    }
}

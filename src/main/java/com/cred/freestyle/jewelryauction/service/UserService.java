package com.cred.freestyle.jewelryauction.service;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.domain.model.User;
import com.cred.freestyle.jewelryauction.exception.ConflictException;
import com.cred.freestyle.jewelryauction.exception.InvalidCredentialsException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import com.cred.freestyle.jewelryauction.repository.UserRepository;
import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.AuthorizationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User registration and administration.
 *
 * @author Jewelry Auction Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    public static final String DUPLICATE_EMAIL = "DUPLICATE_EMAIL";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Register a new member. Emails are compared case-insensitively.
     *
     * @throws ConflictException with code DUPLICATE_EMAIL if the email is taken
     */
    @Transactional
    public User register(String name, String email, String rawPassword, String phone, String address) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Name is required");
        }
        if (email == null || email.isBlank()) {
            throw new ValidationException("email", "Email is required");
        }
        if (rawPassword == null || rawPassword.length() < 8) {
            throw new ValidationException("password", "Password must be at least 8 characters");
        }

        String normalizedEmail = email.trim().toLowerCase();
        if (userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
            logger.warn("Registration rejected, email already in use: {}", normalizedEmail);
            throw new ConflictException(DUPLICATE_EMAIL, "Email " + normalizedEmail + " is already registered");
        }

        User user = User.builder()
                .name(name.trim())
                .email(normalizedEmail)
                .passwordHash(passwordEncoder.encode(rawPassword))
                .role(Role.MEMBER)
                .phone(phone)
                .address(address)
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(DUPLICATE_EMAIL, "Email " + normalizedEmail + " is already registered");
        }

        logger.info("Registered user {} ({})", user.getUserId(), normalizedEmail);
        return user;
    }

    /**
     * Check a login attempt for the upstream gateway, which then forwards the
     * user id and role on every request.
     *
     * @return The active user whose stored hash matches
     * @throws InvalidCredentialsException if the email is unknown, the password does not
     *         match or the account is deactivated
     */
    @Transactional(readOnly = true)
    public User verifyCredentials(String email, String rawPassword) {
        if (email == null || email.isBlank() || rawPassword == null) {
            throw new InvalidCredentialsException();
        }
        String normalizedEmail = email.trim().toLowerCase();
        User user = userRepository.findByEmailIgnoreCase(normalizedEmail)
                .orElseThrow(InvalidCredentialsException::new);

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            logger.warn("Credential check failed for {}", normalizedEmail);
            throw new InvalidCredentialsException();
        }
        if (!Boolean.TRUE.equals(user.getActive())) {
            logger.warn("Credential check for deactivated user {}", user.getUserId());
            throw new InvalidCredentialsException();
        }
        return user;
    }

    @Transactional(readOnly = true)
    public User get(String userId, AuthenticatedUser actor) {
        AuthorizationGate.requireOwnerOrAtLeast(actor, userId, Role.STAFF, "view user");
        return find(userId);
    }

    @Transactional
    public User deactivate(String userId, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.ADMIN, "deactivate user");
        User user = find(userId);
        if (Boolean.TRUE.equals(user.getActive())) {
            user.deactivate();
            user = userRepository.save(user);
            logger.info("User {} deactivated by {}", userId, actor.getUserId());
        }
        return user;
    }

    @Transactional
    public User changeRole(String userId, Role role, AuthenticatedUser actor) {
        AuthorizationGate.requireAtLeast(actor, Role.ADMIN, "change user role");
        if (role == null) {
            throw new ValidationException("role", "Role is required");
        }
        User user = find(userId);
        Role previous = user.getRole();
        user.setRole(role);
        user = userRepository.save(user);
        logger.info("User {} role changed from {} to {} by {}", userId, previous, role, actor.getUserId());
        return user;
    }

    private User find(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }
}

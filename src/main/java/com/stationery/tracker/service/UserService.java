package com.stationery.tracker.service;

import com.stationery.tracker.dto.UserRequest;
import com.stationery.tracker.exception.NotFoundException;
import com.stationery.tracker.exception.ValidationException;
import com.stationery.tracker.model.User;
import com.stationery.tracker.model.UserRole;
import com.stationery.tracker.repository.UserRepository;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;

    public UserService(UserRepository userRepository, PasswordEncoder passwordEncoder, AuditService auditService) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
    }

    // null for system actions
    public User referenceFor(Actor actor) {
        if (actor == null || actor.userId() == null) {
            return null;
        }
        return userRepository.getReferenceById(actor.userId());
    }

    @Transactional(readOnly = true)
    public List<User> listUsers() {
        return userRepository.findAll();
    }

    @Transactional
    public User createUser(UserRequest request, Actor actor) {
        if (userRepository.existsByUsername(request.username())) {
            throw new ValidationException("username", "Username already taken: " + request.username());
        }
        if (request.password() == null || request.password().isBlank()) {
            throw new ValidationException("password", "Password is required for a new user");
        }
        User user = new User();
        user.setUsername(request.username());
        user.setPassword(passwordEncoder.encode(request.password()));
        user.setFullName(request.fullName());
        user.setRole(request.role() != null ? request.role() : UserRole.STAFF);
        user.setActive(request.active() == null || request.active());
        User saved = userRepository.save(user);
        auditService.log(actor, "CREATE_USER", "User: " + saved.getUsername() + ", role " + saved.getRole());
        return saved;
    }

    @Transactional
    public User updateUser(Long id, UserRequest request, Actor actor) {
        User user = userRepository.findById(id).orElseThrow(() -> new NotFoundException("User", id));
        if (!user.getUsername().equals(request.username()) && userRepository.existsByUsername(request.username())) {
            throw new ValidationException("username", "Username already taken: " + request.username());
        }
        user.setUsername(request.username());
        user.setFullName(request.fullName());
        if (request.role() != null) {
            user.setRole(request.role());
        }
        if (request.active() != null) {
            user.setActive(request.active());
        }
        // Blank password keeps the existing hash
        if (request.password() != null && !request.password().isBlank()) {
            user.setPassword(passwordEncoder.encode(request.password()));
        }
        auditService.log(actor, "UPDATE_USER", "User: " + user.getUsername());
        return user;
    }
}

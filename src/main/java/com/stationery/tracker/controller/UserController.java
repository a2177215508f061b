package com.stationery.tracker.controller;

import com.stationery.tracker.dto.UserRequest;
import com.stationery.tracker.dto.UserResponse;
import com.stationery.tracker.service.Actor;
import com.stationery.tracker.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/users")
@PreAuthorize("hasRole('ADMIN')")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public List<UserResponse> list() {
        return userService.listUsers().stream().map(UserResponse::from).collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<UserResponse> create(@Valid @RequestBody UserRequest request, Actor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(userService.createUser(request, actor)));
    }

    @PutMapping("/{id}")
    public UserResponse update(@PathVariable Long id, @Valid @RequestBody UserRequest request, Actor actor) {
        return UserResponse.from(userService.updateUser(id, request, actor));
    }
}

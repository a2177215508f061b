package com.stationery.tracker.dto;

import com.stationery.tracker.model.User;
import com.stationery.tracker.model.UserRole;

public record UserResponse(Long id, String username, String fullName, UserRole role, boolean active) {

    public static UserResponse from(User user) {
        return new UserResponse(user.getId(), user.getUsername(), user.getFullName(), user.getRole(),
                user.isActive());
    }
}

package com.stationery.tracker.dto;

import com.stationery.tracker.model.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record UserRequest(
        @NotBlank @Size(max = 100) String username,
        String password,
        String fullName,
        UserRole role,
        Boolean active) {
}

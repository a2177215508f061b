package com.stationery.tracker.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CustomerRequest(
        @NotBlank @Size(max = 200) String name,
        @Email String email,
        @Size(max = 20) String phone,
        String address,
        Boolean active) {
}

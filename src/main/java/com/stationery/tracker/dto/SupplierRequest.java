package com.stationery.tracker.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SupplierRequest(
        @NotBlank @Size(max = 200) String name,
        String contactPerson,
        @Size(max = 20) String phone,
        @Email String email,
        @Size(max = 500) String address,
        Boolean active) {
}

package com.sentinel.backend.modules.account.presentation.dto;

import java.util.Map;

import com.sentinel.backend.modules.account.domain.AccessLevel;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotBlank(message = "email is required") @Email @Size(max = 120) String email,
        @Size(min = 6, max = 200, message = "password must be 6-200 characters") String password,
        @Size(max = 20) String phone,
        @Size(max = 100) String company,
        @Size(max = 50) String jobTitle,
        String address,
        @Size(max = 50) String city,
        @Size(max = 50) String state,
        @Size(max = 50) String country,
        @Size(max = 15) String postalCode,
        @Size(max = 20) String taxId,
        AccessLevel accessLevel,
        String notes,
        Map<String, String> extraData
) {
}

package com.sentinel.backend.modules.account.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;

public record AccountResponse(
        Long id,
        String name,
        String email,
        String phone,
        String company,
        String jobTitle,
        String address,
        String city,
        String state,
        String country,
        String postalCode,
        String taxId,
        boolean active,
        AccessLevel accessLevel,
        boolean hasPassword,
        OffsetDateTime createdAt,
        OffsetDateTime lastAccessAt,
        String notes,
        Map<String, String> extraData
) {

    public static AccountResponse from(Account account) {
        return new AccountResponse(
                account.getId(),
                account.getName(),
                account.getEmail(),
                account.getPhone(),
                account.getCompany(),
                account.getJobTitle(),
                account.getAddress(),
                account.getCity(),
                account.getState(),
                account.getCountry(),
                account.getPostalCode(),
                account.getTaxId(),
                account.isActive(),
                account.getAccessLevel(),
                account.hasPassword(),
                account.getCreatedAt(),
                account.getLastAccessAt(),
                account.getNotes(),
                account.getExtraData()
        );
    }
}

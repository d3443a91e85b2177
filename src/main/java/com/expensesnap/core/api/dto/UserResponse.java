package com.expensesnap.core.api.dto;

import com.expensesnap.core.domain.UserAccount;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserResponse(UUID id, String name, String email, String role, UUID companyId, OffsetDateTime createdAt) {

    public static UserResponse from(UserAccount u) {
        return new UserResponse(u.getId(), u.getName(), u.getEmail(), u.getRole().wireName(),
                u.getCompanyId(), u.getCreatedAt());
    }
}

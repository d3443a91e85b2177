package com.expensesnap.core.api.dto;

import com.expensesnap.core.domain.InviteCode;

import java.time.OffsetDateTime;
import java.util.UUID;

public record InviteResponse(String code, UUID companyId, String role, OffsetDateTime createdAt) {

    public static InviteResponse from(InviteCode i) {
        return new InviteResponse(i.getCode(), i.getCompanyId(), i.getRole().wireName(), i.getCreatedAt());
    }
}

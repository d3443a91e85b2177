package com.expensesnap.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Single-use registration token binding a new account to a company and role.
 * {@code usedBy} and {@code usedAt} are either both null or both set.
 */
public class InviteCode {

    private final String code;
    private final UUID companyId;
    private final Role role;
    private final UUID createdBy;
    private final UUID usedBy;
    private final OffsetDateTime usedAt;
    private final OffsetDateTime createdAt;

    public InviteCode(String code, UUID companyId, Role role, UUID createdBy, UUID usedBy,
                      OffsetDateTime usedAt, OffsetDateTime createdAt) {
        this.code = code;
        this.companyId = companyId;
        this.role = role;
        this.createdBy = createdBy;
        this.usedBy = usedBy;
        this.usedAt = usedAt;
        this.createdAt = createdAt;
    }

    public boolean isUsed() {
        return usedBy != null;
    }

    public String getCode() {
        return code;
    }

    public UUID getCompanyId() {
        return companyId;
    }

    public Role getRole() {
        return role;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public UUID getUsedBy() {
        return usedBy;
    }

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}

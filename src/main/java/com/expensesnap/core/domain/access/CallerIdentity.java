package com.expensesnap.core.domain.access;

import com.expensesnap.core.domain.Role;

import java.util.UUID;

/**
 * Authenticated caller as resolved from the bearer token. {@code companyId} is null only for super admins.
 */
public record CallerIdentity(UUID userId, String name, String email, Role role, UUID companyId) {

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }
}

package com.expensesnap.core.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public class UserAccount {

    private final UUID id;
    private final String name;
    private final String email;
    private final String passwordHash;
    private final Role role;
    private final UUID companyId;
    private final OffsetDateTime createdAt;

    public UserAccount(UUID id, String name, String email, String passwordHash, Role role, UUID companyId,
                       OffsetDateTime createdAt) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
        this.role = role;
        this.companyId = companyId;
        this.createdAt = createdAt;
    }

    public UserAccount withPasswordHash(String newHash) {
        return new UserAccount(id, name, email, newHash, role, companyId, createdAt);
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Role getRole() {
        return role;
    }

    public UUID getCompanyId() {
        return companyId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}

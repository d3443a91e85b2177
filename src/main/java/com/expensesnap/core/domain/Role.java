package com.expensesnap.core.domain;

import java.util.Arrays;
import java.util.Optional;

public enum Role {
    SUPER_ADMIN("super_admin"),
    COMPANY_ADMIN("company_admin"),
    MEMBER("member");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAdmin() {
        return this == SUPER_ADMIN || this == COMPANY_ADMIN;
    }

    public static Optional<Role> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.wireName.equalsIgnoreCase(v) || r.name().equalsIgnoreCase(v))
                .findFirst();
    }
}

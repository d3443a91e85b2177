package com.expensesnap.core.domain.access;

public record AccessDecision(boolean allowed, DataScope scope, String reason) {

    public static AccessDecision allow(DataScope scope) {
        return new AccessDecision(true, scope, null);
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, null, reason);
    }
}

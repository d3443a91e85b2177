package com.expensesnap.core.domain.access;

public enum TeamAction {
    REMOVE("Cannot remove yourself"),
    RESET_PASSWORD("Cannot reset your own password through team management");

    private final String selfTargetMessage;

    TeamAction(String selfTargetMessage) {
        this.selfTargetMessage = selfTargetMessage;
    }

    public String selfTargetMessage() {
        return selfTargetMessage;
    }
}

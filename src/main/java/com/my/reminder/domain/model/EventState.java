package com.my.reminder.domain.model;

public enum EventState {
    ACTIVE,
    CANCELLED,
    COMPLETED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}

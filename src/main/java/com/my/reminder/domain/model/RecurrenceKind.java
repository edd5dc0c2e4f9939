package com.my.reminder.domain.model;

public enum RecurrenceKind {
    NONE,
    DAILY,
    WEEKLY,
    CUSTOM
}

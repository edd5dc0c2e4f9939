package com.my.reminder.domain.model;

public enum ReplyStatus {
    OK,
    NOT_FOUND,
    REJECTED
}

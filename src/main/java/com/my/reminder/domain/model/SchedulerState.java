package com.my.reminder.domain.model;

public enum SchedulerState {
    IDLE,
    WAITING,
    FIRING,
    DRAINING,
    STOPPED
}

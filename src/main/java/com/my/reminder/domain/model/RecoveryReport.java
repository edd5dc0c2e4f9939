package com.my.reminder.domain.model;

public record RecoveryReport(int scheduled, int caughtUp, int skipped, int corrupt) {

    public int total() {
        return scheduled + caughtUp + skipped;
    }
}

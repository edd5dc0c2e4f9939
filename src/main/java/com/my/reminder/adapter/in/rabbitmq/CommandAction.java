package com.my.reminder.adapter.in.rabbitmq;

public enum CommandAction {
    CREATE,
    MODIFY,
    CANCEL,
    LIST
}

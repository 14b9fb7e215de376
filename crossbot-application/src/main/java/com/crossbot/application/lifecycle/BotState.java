package com.crossbot.application.lifecycle;

public enum BotState {
    IDLE,
    RUNNING
}

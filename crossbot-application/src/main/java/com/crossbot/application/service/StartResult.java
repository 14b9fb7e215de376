package com.crossbot.application.service;

public enum StartResult {
    STARTED,
    ALREADY_RUNNING,
    /** A force-stopped worker has not exited within the stop timeout. */
    STILL_STOPPING
}

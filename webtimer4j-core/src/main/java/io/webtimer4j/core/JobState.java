package io.webtimer4j.core;

public enum JobState {
    IDLE,
    DUE,
    EXECUTING,
    DISABLED
}

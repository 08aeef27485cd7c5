package de.alive.otpfetch.domain;

public enum PollState {
    IDLE,
    CACHE_LOOKUP,
    SCANNING,
    BACKOFF,
    SUCCESS,
    TIMEOUT,
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == TIMEOUT || this == ERROR;
    }
}

package de.alive.otpfetch.domain;

public enum FetchStatus {
    SUCCESS,
    TIMEOUT,
    ERROR
}

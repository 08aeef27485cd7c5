package de.alive.otpfetch.domain;

/**
 * Kind of a fatal fetch failure as reported to the caller.
 */
public enum ErrorKind {
    AUTHENTICATION,
    CONNECTION,
    POOL_EXHAUSTED,
    CONFIGURATION,
    INTERNAL
}

package de.alive.otpfetch.exception;

import de.alive.otpfetch.domain.ErrorKind;

public class MailConnectionException extends Exception {

    private final ConnectionStage stage;

    public enum ConnectionStage {
        POOL_EXHAUSTED,
        CONNECTION_ESTABLISHMENT,
        AUTHENTICATION,
        NETWORK_ERROR,
        CONFIGURATION_ERROR
    }

    public MailConnectionException(String message, ConnectionStage stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public MailConnectionException(String message, ConnectionStage stage) {
        super(message);
        this.stage = stage;
    }

    public static MailConnectionException poolExhausted(String message) {
        return new MailConnectionException(message, ConnectionStage.POOL_EXHAUSTED);
    }

    public static MailConnectionException authentication(String message, Throwable cause) {
        return new MailConnectionException(message, ConnectionStage.AUTHENTICATION, cause);
    }

    public static MailConnectionException network(String message, Throwable cause) {
        return new MailConnectionException(message, ConnectionStage.NETWORK_ERROR, cause);
    }

    public ConnectionStage getStage() {
        return stage;
    }

    public boolean isRecoverable() {
        return stage != ConnectionStage.CONFIGURATION_ERROR &&
                stage != ConnectionStage.AUTHENTICATION;
    }

    /**
     * A transient connection failure that is worth another pool acquisition.
     */
    public boolean isTransient() {
        return stage == ConnectionStage.NETWORK_ERROR ||
                stage == ConnectionStage.CONNECTION_ESTABLISHMENT;
    }

    public ErrorKind toErrorKind() {
        switch (stage) {
            case AUTHENTICATION:
                return ErrorKind.AUTHENTICATION;
            case POOL_EXHAUSTED:
                return ErrorKind.POOL_EXHAUSTED;
            case CONFIGURATION_ERROR:
                return ErrorKind.CONFIGURATION;
            default:
                return ErrorKind.CONNECTION;
        }
    }

    @Override
    public String toString() {
        return String.format("MailConnectionException{stage=%s, message='%s'}",
                stage, getMessage());
    }
}

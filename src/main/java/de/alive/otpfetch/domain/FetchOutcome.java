package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Terminal value of a fetch: a result, a timeout, or a fatal error with its kind.
 */
public final class FetchOutcome {

    private final FetchStatus status;
    @Nullable
    private final FetchResult result;
    @Nullable
    private final ErrorKind errorKind;
    @Nullable
    private final String message;
    private final int rounds;

    private FetchOutcome(FetchStatus status, @Nullable FetchResult result, @Nullable ErrorKind errorKind,
                         @Nullable String message, int rounds) {
        this.status = status;
        this.result = result;
        this.errorKind = errorKind;
        this.message = message;
        this.rounds = rounds;
    }

    public static FetchOutcome success(@NotNull FetchResult result, int rounds) {
        return new FetchOutcome(FetchStatus.SUCCESS, result, null, null, rounds);
    }

    public static FetchOutcome timeout(int rounds) {
        return new FetchOutcome(FetchStatus.TIMEOUT, null, null, "No matching message before the deadline", rounds);
    }

    public static FetchOutcome error(@NotNull ErrorKind kind, @Nullable String message, int rounds) {
        return new FetchOutcome(FetchStatus.ERROR, null, kind, message, rounds);
    }

    public FetchStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    public boolean isTimeout() {
        return status == FetchStatus.TIMEOUT;
    }

    public boolean isError() {
        return status == FetchStatus.ERROR;
    }

    public Optional<FetchResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<ErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    public int getRounds() {
        return rounds;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return String.format("FetchOutcome{SUCCESS, folder=%s, cached=%s, rounds=%d}",
                        result.folder(), result.cached(), rounds);
            case ERROR:
                return String.format("FetchOutcome{ERROR, kind=%s, message='%s', rounds=%d}",
                        errorKind, message, rounds);
            default:
                return String.format("FetchOutcome{TIMEOUT, rounds=%d}", rounds);
        }
    }
}

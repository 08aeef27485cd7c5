package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * One request for an OTP mail. The deadline is the maximum wait, measured from the start of the poll.
 */
public record FetchRequest(
        @NotNull String targetRecipient,
        @NotNull String senderFilter,
        @NotNull Duration deadline
) {

    public FetchRequest {
        if (targetRecipient == null || targetRecipient.trim().isEmpty()) {
            throw new IllegalArgumentException("Target recipient cannot be null or empty");
        }
        if (senderFilter == null || senderFilter.trim().isEmpty()) {
            throw new IllegalArgumentException("Sender filter cannot be null or empty");
        }
        if (deadline == null || deadline.isNegative()) {
            throw new IllegalArgumentException("Deadline must be zero or positive");
        }
        targetRecipient = targetRecipient.trim();
        senderFilter = senderFilter.trim();
    }

    @NotNull
    public CacheKey cacheKey() {
        return new CacheKey(targetRecipient, senderFilter);
    }
}

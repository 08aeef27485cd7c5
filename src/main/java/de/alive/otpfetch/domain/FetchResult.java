package de.alive.otpfetch.domain;

import org.jetbrains.annotations.NotNull;

public record FetchResult(
        @NotNull String otp,
        @NotNull String folder,
        @NotNull String subject,
        boolean cached,
        long fetchTimeMillis
) {

    public FetchResult {
        if (otp == null || otp.isEmpty()) {
            throw new IllegalArgumentException("OTP cannot be null or empty");
        }
        if (fetchTimeMillis < 0) {
            throw new IllegalArgumentException("Fetch time cannot be negative");
        }
    }

    /**
     * The same result as served from the cache.
     */
    public FetchResult asCached() {
        return new FetchResult(otp, folder, subject, true, 0L);
    }
}

package de.alive.otpfetch.cache;

import de.alive.otpfetch.domain.CacheKey;
import de.alive.otpfetch.domain.FetchResult;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;

public record CacheEntry(
        @NotNull CacheKey key,
        @NotNull FetchResult result,
        @NotNull Instant expiresAt
) {

    public boolean isExpired(@NotNull Instant now) {
        return !now.isBefore(expiresAt);
    }
}

package de.alive.otpfetch.cache;

import de.alive.otpfetch.domain.CacheKey;
import de.alive.otpfetch.domain.FetchResult;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last successful result per key, valid until its expiry. Expired entries are dropped when read.
 */
@Slf4j
public class ResultCache {

    private final ConcurrentHashMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private final Clock clock;
    private final int maxEntries;

    public ResultCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public ResultCache(int maxEntries, @NotNull Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Max entries must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    @NotNull
    public Optional<CacheEntry> get(@NotNull CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            log.debug("Cache entry for {} expired", key);
            return Optional.empty();
        }

        log.info("{} Cache HIT for {}", LogUtils.SUCCESS_EMOJI, key);
        return Optional.of(entry);
    }

    /**
     * Stores {@code result} for {@code key}, replacing any previous entry.
     */
    @NotNull
    public CacheEntry put(@NotNull CacheKey key, @NotNull FetchResult result, @NotNull Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }

        CacheEntry entry = new CacheEntry(key, result, clock.instant().plus(ttl));
        synchronized (writeLock) {
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                evictOne();
            }
            entries.put(key, entry);
        }

        log.info("{} Cache STORED for {} (ttl {}s)", LogUtils.SUCCESS_EMOJI, key, ttl.toSeconds());
        return entry;
    }

    public boolean invalidate(@NotNull CacheKey key) {
        return entries.remove(key) != null;
    }

    /**
     * Removes every expired entry and returns how many were dropped.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Purged {} expired cache entries", purged);
        }
        return purged;
    }

    public void clear() {
        entries.clear();
        log.info("Cache cleared");
    }

    public int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    private void evictOne() {
        if (purgeExpired() > 0) {
            return;
        }
        entries.values().stream()
                .min(Comparator.comparing(CacheEntry::expiresAt))
                .ifPresent(oldest -> {
                    entries.remove(oldest.key(), oldest);
                    log.debug("Cache full, evicted {}", oldest.key());
                });
    }
}

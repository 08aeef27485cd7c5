package de.alive.otpfetch.service.config;

import de.alive.otpfetch.parser.OtpExtractionRule;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.List;

@Data
@Builder(toBuilder = true)
public class FetchConfiguration {

    // Mailbox endpoint
    private final String host;
    private final int port;
    private final Duration connectionTimeout;

    // Connection pool
    private final int poolSize;
    private final Duration acquireTimeout;
    private final Duration idleTimeout;
    private final int maxLeasesPerConnection;
    private final int maxConnectRetries;

    // Scanning
    private final List<String> folders;
    private final int scanLimit;
    private final int maxScanRetries;
    private final boolean recipientFilterEnabled;
    private final Duration maxMessageAge;
    private final OtpExtractionRule extractionRule;

    // Cache
    private final Duration cacheTtl;
    private final int maxCacheEntries;

    // Polling
    private final Duration backoffInterval;
    private final double backoffMultiplier;
    private final Duration maxBackoff;
    private final Duration defaultDeadline;

    // Default values
    public static final String DEFAULT_HOST = "imap.gmail.com";
    public static final int DEFAULT_PORT = 993;
    public static final int DEFAULT_POOL_SIZE = 10;
    public static final int DEFAULT_SCAN_LIMIT = 30;
    public static final int DEFAULT_MAX_LEASES_PER_CONNECTION = 50;
    public static final int DEFAULT_MAX_CACHE_ENTRIES = 1000;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_BACKOFF_INTERVAL = Duration.ofMillis(500);
    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(120);
    public static final List<String> DEFAULT_FOLDERS = List.of("INBOX", "[Gmail]/Spam");

    public static FetchConfiguration forProduction() {
        return FetchConfiguration.builder()
                .host(DEFAULT_HOST)
                .port(DEFAULT_PORT)
                .connectionTimeout(Duration.ofSeconds(10))
                .poolSize(DEFAULT_POOL_SIZE)
                .acquireTimeout(Duration.ofSeconds(30))
                .idleTimeout(Duration.ofMinutes(5))
                .maxLeasesPerConnection(DEFAULT_MAX_LEASES_PER_CONNECTION)
                .maxConnectRetries(3)
                .folders(DEFAULT_FOLDERS)
                .scanLimit(DEFAULT_SCAN_LIMIT)
                .maxScanRetries(2)
                .recipientFilterEnabled(false)
                .maxMessageAge(Duration.ZERO)
                .extractionRule(OtpExtractionRule.defaults())
                .cacheTtl(DEFAULT_CACHE_TTL)
                .maxCacheEntries(DEFAULT_MAX_CACHE_ENTRIES)
                .backoffInterval(DEFAULT_BACKOFF_INTERVAL)
                .backoffMultiplier(1.0)
                .maxBackoff(Duration.ofSeconds(5))
                .defaultDeadline(DEFAULT_DEADLINE)
                .build();
    }

    public static FetchConfiguration forTesting() {
        return forProduction().toBuilder()
                .host("localhost")
                .poolSize(4)
                .acquireTimeout(Duration.ofSeconds(2))
                .connectionTimeout(Duration.ofSeconds(2))
                .maxConnectRetries(0)
                .backoffInterval(Duration.ofMillis(20))
                .maxBackoff(Duration.ofMillis(100))
                .defaultDeadline(Duration.ofSeconds(2))
                .build();
    }

    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        if (maxLeasesPerConnection <= 0) {
            throw new IllegalArgumentException("Max leases per connection must be positive");
        }
        if (maxConnectRetries < 0 || maxScanRetries < 0) {
            throw new IllegalArgumentException("Retry counts cannot be negative");
        }
        if (folders == null || folders.isEmpty()) {
            throw new IllegalArgumentException("At least one folder must be configured");
        }
        if (scanLimit <= 0) {
            throw new IllegalArgumentException("Scan limit must be positive");
        }
        if (maxMessageAge == null || maxMessageAge.isNegative()) {
            throw new IllegalArgumentException("Max message age must be zero or positive");
        }
        if (extractionRule == null) {
            throw new IllegalArgumentException("Extraction rule cannot be null");
        }
        if (maxCacheEntries <= 0) {
            throw new IllegalArgumentException("Max cache entries must be positive");
        }
        requirePositive(connectionTimeout, "Connection timeout");
        requirePositive(acquireTimeout, "Acquire timeout");
        requirePositive(idleTimeout, "Idle timeout");
        requirePositive(cacheTtl, "Cache TTL");
        requirePositive(backoffInterval, "Backoff interval");
        requirePositive(maxBackoff, "Max backoff");
        if (defaultDeadline == null || defaultDeadline.isNegative()) {
            throw new IllegalArgumentException("Default deadline must be zero or positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
        }
        if (maxBackoff.compareTo(backoffInterval) < 0) {
            throw new IllegalArgumentException("Max backoff cannot be shorter than the backoff interval");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Backoff before the given round (1-based) starts its successor.
     */
    public Duration backoffAfterRound(int round) {
        if (backoffMultiplier == 1.0 || round <= 1) {
            return backoffInterval;
        }
        double millis = backoffInterval.toMillis() * Math.pow(backoffMultiplier, round - 1);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }

    public boolean isAdaptiveBackoff() {
        return backoffMultiplier > 1.0;
    }

    public String getConfigurationSummary() {
        return String.format(
                "Host: %s:%d, Pool: %d, Folders: %s, Limit: %d, TTL: %ds, Backoff: %dms%s%s",
                host, port, poolSize, folders, scanLimit, cacheTtl.toSeconds(),
                backoffInterval.toMillis(), isAdaptiveBackoff() ? " x" + backoffMultiplier : "",
                maxMessageAge.isZero() ? "" : ", Max age: " + maxMessageAge.toHours() + "h"
        );
    }
}

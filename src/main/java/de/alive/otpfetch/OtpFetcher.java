package de.alive.otpfetch;

import de.alive.otpfetch.cache.ResultCache;
import de.alive.otpfetch.domain.FetchOutcome;
import de.alive.otpfetch.domain.FetchRequest;
import de.alive.otpfetch.domain.FetcherStatistics;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.infrastructure.ConnectionManager;
import de.alive.otpfetch.infrastructure.ConnectionPool;
import de.alive.otpfetch.infrastructure.EmailContentExtractor;
import de.alive.otpfetch.infrastructure.ImapConnectionManager;
import de.alive.otpfetch.parser.MessageParser;
import de.alive.otpfetch.service.FolderScanner;
import de.alive.otpfetch.service.OtpPoller;
import de.alive.otpfetch.service.config.FetchConfiguration;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Entry point of the engine: owns the connection pool and the result cache for one mailbox and hands
 * requests to the {@link OtpPoller}. Close it to drain the pool.
 */
@Slf4j
public class OtpFetcher implements AutoCloseable {

    private final FetchConfiguration config;
    private final ConnectionPool pool;
    private final ResultCache cache;
    private final OtpPoller poller;

    public OtpFetcher(@NotNull Configuration configuration) {
        this(configuration, new ImapConnectionManager(configuration));
    }

    public OtpFetcher(@NotNull Configuration configuration, @NotNull ConnectionManager connectionManager) {
        this.config = configuration.fetchConfig();
        config.validate();
        this.pool = new ConnectionPool(connectionManager, config.getPoolSize(),
                config.getIdleTimeout(), config.getMaxLeasesPerConnection());
        this.cache = new ResultCache(config.getMaxCacheEntries());
        FolderScanner scanner = new FolderScanner(new EmailContentExtractor(),
                new MessageParser(config.getExtractionRule()), config.getScanLimit(), config.isRecipientFilterEnabled(),
                config.getMaxMessageAge(), Clock.systemUTC());
        this.poller = new OtpPoller(pool, scanner, cache, config);

        log.info("{} OTP fetcher ready for {} ({})", LogUtils.ROCKET_EMOJI,
                LogUtils.maskEmail(configuration.username()), config.getConfigurationSummary());
    }

    @NotNull
    public Mono<FetchOutcome> fetchOtp(@NotNull FetchRequest request) {
        return poller.fetch(request);
    }

    @NotNull
    public Mono<FetchOutcome> fetchOtp(@NotNull String targetRecipient, @NotNull String sender, @NotNull Duration maxWait) {
        return fetchOtp(new FetchRequest(targetRecipient, sender, maxWait));
    }

    @NotNull
    public Mono<FetchOutcome> fetchOtp(@NotNull String targetRecipient, @NotNull String sender) {
        return fetchOtp(targetRecipient, sender, config.getDefaultDeadline());
    }

    @NotNull
    public FetchOutcome fetchOtpBlocking(@NotNull String targetRecipient, @NotNull String sender,
                                         @NotNull Duration maxWait) {
        return fetchOtp(targetRecipient, sender, maxWait).block();
    }

    /**
     * Opens {@code connections} sessions ahead of the first request.
     */
    @NotNull
    public Mono<Integer> warmUp(int connections) {
        return Mono.fromCallable(() -> pool.initialize(connections))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnError(MailConnectionException.class, e ->
                        log.error("{} Warm-up failed: {}", LogUtils.ERROR_EMOJI, e.getMessage()));
    }

    @NotNull
    public FetcherStatistics getStatistics() {
        return new FetcherStatistics(pool.getStatistics(), cache.size(),
                poller.getInFlightCount(), poller.getTotalRequests());
    }

    @NotNull
    public ResultCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        log.info("{} Shutting down OTP fetcher...", LogUtils.STOP_EMOJI);
        pool.shutdown();
        cache.clear();
        log.info("{} OTP fetcher shutdown complete", LogUtils.SUCCESS_EMOJI);
    }
}

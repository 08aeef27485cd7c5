package de.alive.otpfetch.service;

import de.alive.otpfetch.cache.CacheEntry;
import de.alive.otpfetch.cache.ResultCache;
import de.alive.otpfetch.domain.CacheKey;
import de.alive.otpfetch.domain.ErrorKind;
import de.alive.otpfetch.domain.FetchOutcome;
import de.alive.otpfetch.domain.FetchRequest;
import de.alive.otpfetch.domain.FetchResult;
import de.alive.otpfetch.domain.OtpCandidate;
import de.alive.otpfetch.domain.PollState;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.infrastructure.ConnectionPool;
import de.alive.otpfetch.infrastructure.IConnection;
import de.alive.otpfetch.service.config.FetchConfiguration;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one fetch from cache lookup through repeated scan rounds to a terminal outcome.
 * <p>
 * Each round scans all configured folders in parallel, one leased connection per folder, and only picks
 * a winner once every folder has answered. Between rounds the poller waits the configured backoff. The
 * request deadline bounds the whole poll: no round starts after it and a round still running when it
 * passes is abandoned. A round that is still opening connections at the deadline runs until those
 * connection attempts settle, so a rejected login is reported as an error rather than a timeout.
 * <p>
 * Concurrent fetches for the same {@link CacheKey} share one poll and receive the same outcome.
 */
@Slf4j
public class OtpPoller {

    private static final Duration MINIMUM_ROUND_WINDOW = Duration.ofMillis(1);
    private static final Duration CONNECT_SETTLE_CHECK = Duration.ofMillis(10);

    @NotNull
    private final ConnectionPool pool;
    @NotNull
    private final FolderScanner scanner;
    @NotNull
    private final ResultCache cache;
    @NotNull
    private final FetchConfiguration config;
    @NotNull
    private final Scheduler scanScheduler;

    private final ConcurrentHashMap<CacheKey, Mono<FetchOutcome>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalPolls = new AtomicLong();

    public OtpPoller(@NotNull ConnectionPool pool, @NotNull FolderScanner scanner,
                     @NotNull ResultCache cache, @NotNull FetchConfiguration config) {
        this(pool, scanner, cache, config, Schedulers.boundedElastic());
    }

    public OtpPoller(@NotNull ConnectionPool pool, @NotNull FolderScanner scanner, @NotNull ResultCache cache,
                     @NotNull FetchConfiguration config, @NotNull Scheduler scanScheduler) {
        this.pool = pool;
        this.scanner = scanner;
        this.cache = cache;
        this.config = config;
        this.scanScheduler = scanScheduler;
    }

    /**
     * Fetches the code for {@code request}, joining a poll already running for the same key.
     * The returned Mono always completes with an outcome and never signals an error.
     */
    @NotNull
    public Mono<FetchOutcome> fetch(@NotNull FetchRequest request) {
        return Mono.defer(() -> {
            totalRequests.incrementAndGet();
            CacheKey key = request.cacheKey();
            return inFlight.computeIfAbsent(key, k -> startPoll(k, request));
        });
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalPolls() {
        return totalPolls.get();
    }

    private Mono<FetchOutcome> startPoll(CacheKey key, FetchRequest request) {
        AtomicReference<Mono<FetchOutcome>> self = new AtomicReference<>();
        // leave the in-flight map before the outcome reaches any caller
        Mono<FetchOutcome> shared = poll(new PollContext(request))
                .doOnTerminate(() -> inFlight.remove(key, self.get()))
                .cache();
        self.set(shared);
        return shared;
    }

    private Mono<FetchOutcome> poll(PollContext context) {
        return Mono.defer(() -> {
                    totalPolls.incrementAndGet();
                    context.transition(PollState.CACHE_LOOKUP);

                    Optional<CacheEntry> hit = cache.get(context.key);
                    if (hit.isPresent()) {
                        context.transition(PollState.SUCCESS);
                        return Mono.just(FetchOutcome.success(hit.get().result().asCached(), 0));
                    }

                    log.info("{} Polling for {} from {} (deadline {})", LogUtils.SEARCH_EMOJI,
                            LogUtils.maskEmail(context.request.targetRecipient()), context.request.senderFilter(),
                            LogUtils.formatDuration(context.request.deadline().toMillis(), true));
                    return scanUntilDeadline(context);
                })
                .onErrorResume(error -> Mono.just(failed(context, error)))
                .doOnNext(outcome -> logOutcome(context, outcome));
    }

    private Mono<FetchOutcome> scanUntilDeadline(PollContext context) {
        return Mono.defer(() -> scanRound(context))
                .repeatWhenEmpty(Integer.MAX_VALUE, emptyRounds -> emptyRounds
                        .map(ignored -> config.backoffAfterRound(context.rounds.get()))
                        .takeWhile(context::hasTimeFor)
                        .concatMap(backoff -> {
                            context.transition(PollState.BACKOFF);
                            return Mono.delay(backoff);
                        }))
                .map(winner -> succeeded(context, winner))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    context.transition(PollState.TIMEOUT);
                    return FetchOutcome.timeout(context.rounds.get());
                }));
    }

    private Mono<OtpCandidate> scanRound(PollContext context) {
        context.transition(PollState.SCANNING);
        int round = context.rounds.incrementAndGet();
        List<String> folders = config.getFolders();
        int concurrency = Math.min(folders.size(), pool.getMaxSize());

        Duration window = context.remaining();
        if (window.compareTo(MINIMUM_ROUND_WINDOW) < 0) {
            window = MINIMUM_ROUND_WINDOW;
        }

        return Flux.fromIterable(folders)
                .flatMap(folder -> scanFolder(context, folder), concurrency)
                .flatMapIterable(candidates -> candidates)
                .collectList()
                .timeout(deadlineReached(context, window))
                .onErrorResume(TimeoutException.class, e -> {
                    log.debug("{} Round {} abandoned at the deadline", LogUtils.TIMER_EMOJI, round);
                    return Mono.just(List.of());
                })
                .flatMap(candidates -> {
                    Optional<OtpCandidate> winner = candidates.stream().min(OtpCandidate.RANKING);
                    if (winner.isEmpty()) {
                        log.debug("Round {} for {}: no match", round, context.key);
                    }
                    return Mono.justOrEmpty(winner);
                });
    }

    /**
     * Fires once {@code window} has passed and no connection of this poll is still being opened.
     */
    private Mono<Long> deadlineReached(PollContext context, Duration window) {
        return Flux.interval(window, CONNECT_SETTLE_CHECK)
                .filter(tick -> context.connecting.get() == 0)
                .next();
    }

    private Mono<List<OtpCandidate>> scanFolder(PollContext context, String folder) {
        return Mono.defer(() -> leaseAndScan(context, folder))
                .retryWhen(Retry.max(config.getMaxScanRetries())
                        .filter(OtpPoller::isBrokenLease)
                        .doBeforeRetry(signal -> log.warn("{} Retrying scan of {} ({}/{}): {}",
                                LogUtils.WARNING_EMOJI, folder, signal.totalRetries() + 1,
                                config.getMaxScanRetries(), signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorResume(OtpPoller::isPoolExhausted, error -> {
                    log.warn("{} No connection for {} this round: {}",
                            LogUtils.WARNING_EMOJI, folder, error.getMessage());
                    return Mono.just(List.of());
                });
    }

    /**
     * Counts the attempt as connecting from subscription until its lease is granted or refused.
     */
    private Mono<List<OtpCandidate>> leaseAndScan(PollContext context, String folder) {
        AtomicBoolean pending = new AtomicBoolean(true);
        context.connecting.incrementAndGet();
        Runnable settled = () -> {
            if (pending.compareAndSet(true, false)) {
                context.connecting.decrementAndGet();
            }
        };
        return Mono.fromCallable(() -> scanWithLease(context, folder, settled))
                .subscribeOn(scanScheduler)
                .doFinally(signal -> settled.run());
    }

    /**
     * Blocking: leases, scans and always releases, even when the round was abandoned meanwhile.
     */
    private List<OtpCandidate> scanWithLease(PollContext context, String folder, Runnable leaseSettled)
            throws MailConnectionException {
        Duration acquireTimeout = context.remaining();
        if (acquireTimeout.compareTo(config.getAcquireTimeout()) > 0) {
            acquireTimeout = config.getAcquireTimeout();
        }

        IConnection connection;
        try {
            connection = pool.acquire(acquireTimeout);
        } finally {
            leaseSettled.run();
        }

        boolean healthy = false;
        try {
            List<OtpCandidate> candidates = scanner.scan(connection, folder, context.request);
            healthy = true;
            return candidates;
        } finally {
            pool.release(connection, healthy);
        }
    }

    private FetchOutcome succeeded(PollContext context, OtpCandidate winner) {
        FetchResult result = winner.toResult(context.elapsedMillis());
        cache.put(context.key, result, config.getCacheTtl());
        context.transition(PollState.SUCCESS);
        return FetchOutcome.success(result, context.rounds.get());
    }

    private FetchOutcome failed(PollContext context, Throwable error) {
        context.transition(PollState.ERROR);
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof MailConnectionException) {
            MailConnectionException connectionError = (MailConnectionException) cause;
            return FetchOutcome.error(connectionError.toErrorKind(), connectionError.getMessage(),
                    context.rounds.get());
        }
        log.error("{} Unexpected failure while polling for {}", LogUtils.ERROR_EMOJI, context.key, cause);
        return FetchOutcome.error(ErrorKind.INTERNAL, String.valueOf(cause.getMessage()), context.rounds.get());
    }

    private void logOutcome(PollContext context, FetchOutcome outcome) {
        String recipient = LogUtils.maskEmail(context.request.targetRecipient());
        if (outcome.isSuccess()) {
            FetchResult result = outcome.getResult().orElseThrow();
            log.info("{} OTP {} for {} from {} ({}ms, {} rounds{})", LogUtils.SUCCESS_EMOJI,
                    LogUtils.maskOtp(result.otp()), recipient, result.folder(), result.fetchTimeMillis(),
                    outcome.getRounds(), result.cached() ? ", cached" : "");
        } else if (outcome.isTimeout()) {
            log.info("{} No OTP for {} after {} rounds", LogUtils.TIMER_EMOJI, recipient, outcome.getRounds());
        } else {
            log.error("{} Fetch for {} failed: {} {}", LogUtils.ERROR_EMOJI, recipient,
                    outcome.getErrorKind().orElse(ErrorKind.INTERNAL), outcome.getMessage());
        }
    }

    // connect failures were already retried by the connection manager
    private static boolean isBrokenLease(Throwable error) {
        return error instanceof MailConnectionException
                && ((MailConnectionException) error).getStage() == MailConnectionException.ConnectionStage.NETWORK_ERROR;
    }

    private static boolean isPoolExhausted(Throwable error) {
        return error instanceof MailConnectionException
                && ((MailConnectionException) error).getStage() == MailConnectionException.ConnectionStage.POOL_EXHAUSTED;
    }

    private static final class PollContext {
        private final FetchRequest request;
        private final CacheKey key;
        private final long startNanos;
        private final long deadlineNanos;
        private final AtomicInteger rounds = new AtomicInteger();
        private final AtomicInteger connecting = new AtomicInteger();
        private volatile PollState state = PollState.IDLE;

        private PollContext(FetchRequest request) {
            this.request = request;
            this.key = request.cacheKey();
            this.startNanos = System.nanoTime();
            this.deadlineNanos = startNanos + request.deadline().toNanos();
        }

        private void transition(PollState next) {
            log.debug("Poll {}: {} -> {}", key, state, next);
            state = next;
        }

        private long elapsedMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }

        private Duration remaining() {
            long remaining = deadlineNanos - System.nanoTime();
            return remaining <= 0 ? Duration.ZERO : Duration.ofNanos(remaining);
        }

        private boolean hasTimeFor(Duration backoff) {
            return System.nanoTime() + backoff.toNanos() <= deadlineNanos;
        }
    }
}

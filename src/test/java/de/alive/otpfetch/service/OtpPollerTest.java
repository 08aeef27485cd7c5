package de.alive.otpfetch.service;

import de.alive.otpfetch.cache.ResultCache;
import de.alive.otpfetch.domain.CacheKey;
import de.alive.otpfetch.domain.ErrorKind;
import de.alive.otpfetch.domain.FetchOutcome;
import de.alive.otpfetch.domain.FetchRequest;
import de.alive.otpfetch.domain.FetchResult;
import de.alive.otpfetch.domain.OtpCandidate;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.infrastructure.ConnectionManager;
import de.alive.otpfetch.infrastructure.ConnectionPool;
import de.alive.otpfetch.infrastructure.IConnection;
import de.alive.otpfetch.service.config.FetchConfiguration;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

import javax.mail.AuthenticationFailedException;
import javax.mail.Store;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OtpPollerTest {

    private static final String SENDER = "noreply@tm.openai.com";
    private static final String RECIPIENT = "user@example.com";
    private static final String INBOX = "INBOX";
    private static final String SPAM = "[Gmail]/Spam";
    private static final Instant RECEIVED = Instant.parse("2024-01-01T10:00:00Z");
    private static final Duration BLOCK_TIMEOUT = Duration.ofSeconds(10);

    private FakeConnectionManager connectionManager;
    private ConnectionPool pool;
    private FolderScanner scanner;
    private ResultCache cache;
    private FetchConfiguration config;
    private OtpPoller poller;

    @BeforeEach
    void setUp() {
        config = FetchConfiguration.forTesting();
        connectionManager = new FakeConnectionManager();
        pool = new ConnectionPool(connectionManager, config.getPoolSize(), config.getIdleTimeout(),
                config.getMaxLeasesPerConnection());
        scanner = mock(FolderScanner.class);
        cache = new ResultCache(config.getMaxCacheEntries());
        poller = new OtpPoller(pool, scanner, cache, config);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void testCacheHitSkipsScanning() {
        cache.put(new CacheKey(RECIPIENT, SENDER), new FetchResult("482913", INBOX, "Your code", false, 812L),
                Duration.ofMinutes(5));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(1))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isSuccess());
        FetchResult result = outcome.getResult().orElseThrow();
        assertEquals("482913", result.otp());
        assertTrue(result.cached());
        assertEquals(0, outcome.getRounds());
        verifyNoInteractions(scanner);
        assertEquals(0, connectionManager.created.get());
    }

    @Test
    void testFirstRoundMatchIsReturnedAndCached() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("482913", INBOX, 10L, RECEIVED)));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isSuccess());
        FetchResult result = outcome.getResult().orElseThrow();
        assertEquals("482913", result.otp());
        assertEquals(INBOX, result.folder());
        assertFalse(result.cached());
        assertEquals(1, outcome.getRounds());
        assertTrue(cache.get(new CacheKey(RECIPIENT, SENDER)).isPresent());
        verify(scanner).scan(any(IConnection.class), eq(SPAM), any(FetchRequest.class));
    }

    @Test
    void testSecondCallIsServedFromCache() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("482913", INBOX, 10L, RECEIVED)));

        poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);
        FetchOutcome second = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(second.getResult().orElseThrow().cached());
        verify(scanner, times(1)).scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class));
    }

    @Test
    void testEarliestReceivedMessageWins() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("222222", INBOX, 5L, RECEIVED.plusSeconds(30))));
        when(scanner.scan(any(IConnection.class), eq(SPAM), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("111111", SPAM, 9L, RECEIVED)));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertEquals("111111", outcome.getResult().orElseThrow().otp());
        assertEquals(SPAM, outcome.getResult().orElseThrow().folder());
    }

    @Test
    void testTieBreaksOnFolderThenUid() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("333333", INBOX, 8L, RECEIVED), candidate("444444", INBOX, 7L, RECEIVED)));
        when(scanner.scan(any(IConnection.class), eq(SPAM), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("555555", SPAM, 1L, RECEIVED)));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        FetchResult result = outcome.getResult().orElseThrow();
        assertEquals(INBOX, result.folder());
        assertEquals("444444", result.otp());
    }

    @Test
    void testKeepsPollingUntilMatchArrives() throws Exception {
        AtomicInteger inboxScans = new AtomicInteger();
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class))).thenAnswer(invocation ->
                inboxScans.incrementAndGet() < 3 ? List.of() : List.of(candidate("482913", INBOX, 1L, RECEIVED)));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isSuccess());
        assertEquals(3, outcome.getRounds());
    }

    @Test
    void testZeroDeadlineTimesOut() {
        FetchOutcome outcome = poller.fetch(request(Duration.ZERO)).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isTimeout());
        assertTrue(outcome.getResult().isEmpty());
        assertTrue(cache.get(new CacheKey(RECIPIENT, SENDER)).isEmpty());
    }

    @Test
    void testNoMatchTimesOutNearDeadline() {
        long start = System.nanoTime();

        FetchOutcome outcome = poller.fetch(request(Duration.ofMillis(200))).block(BLOCK_TIMEOUT);

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        assertTrue(outcome.isTimeout());
        assertTrue(outcome.getRounds() > 1);
        assertTrue(elapsedMillis < 1500, "took " + elapsedMillis + "ms");
    }

    @Test
    void testHangingScanIsAbandonedAtDeadline() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return List.of(candidate("482913", INBOX, 1L, RECEIVED));
        });
        long start = System.nanoTime();

        FetchOutcome outcome = poller.fetch(request(Duration.ofMillis(200))).block(BLOCK_TIMEOUT);

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        assertTrue(outcome.isTimeout());
        assertTrue(elapsedMillis < 1500, "took " + elapsedMillis + "ms");
    }

    @Test
    void testAuthenticationFailureEndsInError() {
        connectionManager.failure = MailConnectionException.authentication("Invalid credentials",
                new AuthenticationFailedException("[AUTHENTICATIONFAILED]"));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isError());
        assertFalse(outcome.isTimeout());
        assertEquals(ErrorKind.AUTHENTICATION, outcome.getErrorKind().orElseThrow());
        assertEquals(1, outcome.getRounds());
    }

    @Test
    void testSlowAuthenticationFailureIsNotReportedAsTimeout() {
        connectionManager.failure = MailConnectionException.authentication("Invalid credentials",
                new AuthenticationFailedException("[AUTHENTICATIONFAILED]"));
        connectionManager.connectDelay = Duration.ofMillis(150);

        FetchOutcome outcome = poller.fetch(request(Duration.ofMillis(50))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isError(), outcome.toString());
        assertEquals(ErrorKind.AUTHENTICATION, outcome.getErrorKind().orElseThrow());
        assertEquals(1, outcome.getRounds());
    }

    @Test
    void testAuthenticationFailureWithZeroDeadlineIsReported() {
        connectionManager.failure = MailConnectionException.authentication("Invalid credentials",
                new AuthenticationFailedException("[AUTHENTICATIONFAILED]"));
        connectionManager.connectDelay = Duration.ofMillis(100);

        FetchOutcome outcome = poller.fetch(request(Duration.ZERO)).block(BLOCK_TIMEOUT);

        assertEquals(ErrorKind.AUTHENTICATION, outcome.getErrorKind().orElseThrow());
    }

    @Test
    void testConnectFailureIsNotRetriedByThePoller() {
        FetchConfiguration inboxOnly = config.toBuilder().folders(List.of(INBOX)).build();
        poller = new OtpPoller(pool, scanner, cache, inboxOnly);
        connectionManager.failure = new MailConnectionException("connection refused",
                MailConnectionException.ConnectionStage.CONNECTION_ESTABLISHMENT);

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertEquals(ErrorKind.CONNECTION, outcome.getErrorKind().orElseThrow());
        assertEquals(1, connectionManager.attempts.get());
        verifyNoInteractions(scanner);
    }

    @Test
    void testBrokenConnectionIsRetriedThenReported() throws Exception {
        FetchConfiguration inboxOnly = config.toBuilder().folders(List.of(INBOX)).build();
        poller = new OtpPoller(pool, scanner, cache, inboxOnly);
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenThrow(MailConnectionException.network("connection reset", null));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isError());
        assertEquals(ErrorKind.CONNECTION, outcome.getErrorKind().orElseThrow());
        verify(scanner, times(inboxOnly.getMaxScanRetries() + 1))
                .scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class));
        assertEquals(inboxOnly.getMaxScanRetries() + 1, connectionManager.created.get());
        assertEquals(0, pool.getStatistics().leased());
    }

    @Test
    void testRetrySucceedsOnFreshConnection() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenThrow(MailConnectionException.network("connection reset", null))
                .thenReturn(List.of(candidate("482913", INBOX, 1L, RECEIVED)));

        FetchOutcome outcome = poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getRounds());
    }

    @Test
    void testExhaustedPoolYieldsEmptyRounds() throws Exception {
        ConnectionPool tiny = new ConnectionPool(connectionManager, 1, config.getIdleTimeout(), 50);
        IConnection held = tiny.acquire(Duration.ofSeconds(1));
        poller = new OtpPoller(tiny, scanner, cache, config);

        FetchOutcome outcome = poller.fetch(request(Duration.ofMillis(300))).block(BLOCK_TIMEOUT);

        assertTrue(outcome.isTimeout());
        verifyNoInteractions(scanner);
        tiny.release(held, true);
        tiny.shutdown();
    }

    @Test
    void testConcurrentRequestsForSameKeyShareOnePoll() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(200);
            return List.of(candidate("482913", INBOX, 1L, RECEIVED));
        });

        Tuple2<FetchOutcome, FetchOutcome> outcomes = Mono.zip(
                        poller.fetch(request(Duration.ofSeconds(2))),
                        poller.fetch(new FetchRequest("USER@Example.com", SENDER, Duration.ofSeconds(2))))
                .block(BLOCK_TIMEOUT);

        assertSame(outcomes.getT1(), outcomes.getT2());
        assertEquals("482913", outcomes.getT1().getResult().orElseThrow().otp());
        assertEquals(1, poller.getTotalPolls());
        assertEquals(2, poller.getTotalRequests());
        verify(scanner, times(1)).scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class));
        assertEquals(0, poller.getInFlightCount());
    }

    @Test
    void testDifferentKeysPollIndependently() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("482913", INBOX, 1L, RECEIVED)));

        Mono.zip(poller.fetch(request(Duration.ofSeconds(2))),
                        poller.fetch(new FetchRequest("other@example.com", SENDER, Duration.ofSeconds(2))))
                .block(BLOCK_TIMEOUT);

        assertEquals(2, poller.getTotalPolls());
    }

    @Test
    void testLeasesAreReturnedAfterPoll() throws Exception {
        when(scanner.scan(any(IConnection.class), eq(INBOX), any(FetchRequest.class)))
                .thenReturn(List.of(candidate("482913", INBOX, 1L, RECEIVED)));

        poller.fetch(request(Duration.ofSeconds(2))).block(BLOCK_TIMEOUT);

        assertEquals(0, pool.getStatistics().leased());
        assertTrue(pool.getStatistics().live() <= config.getPoolSize());
    }

    private static FetchRequest request(Duration deadline) {
        return new FetchRequest(RECIPIENT, SENDER, deadline);
    }

    private static OtpCandidate candidate(String otp, String folder, long uid, Instant receivedAt) {
        return new OtpCandidate(otp, folder, "Your code", uid, receivedAt);
    }

    private static final class LiveConnection implements IConnection {
        private static final Store STORE = mock(Store.class);
        private final int id;

        private LiveConnection(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }

        @NotNull
        @Override
        public Store getStore() {
            return STORE;
        }

        @Override
        public boolean isConnected() {
            return true;
        }
    }

    private static final class FakeConnectionManager implements ConnectionManager {
        private final AtomicInteger created = new AtomicInteger();
        private final AtomicInteger attempts = new AtomicInteger();
        private volatile MailConnectionException failure;
        private volatile Duration connectDelay = Duration.ZERO;

        @NotNull
        @Override
        public Mono<IConnection> createConnection() {
            attempts.incrementAndGet();
            if (failure != null) {
                return Mono.delay(connectDelay).then(Mono.error(failure));
            }
            return Mono.fromCallable(() -> new LiveConnection(created.incrementAndGet()));
        }

        @NotNull
        @Override
        public Mono<Boolean> closeConnection(@NotNull IConnection connection) {
            return Mono.just(true);
        }
    }
}

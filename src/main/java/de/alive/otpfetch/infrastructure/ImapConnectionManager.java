package de.alive.otpfetch.infrastructure;

import de.alive.otpfetch.Configuration;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.service.config.FetchConfiguration;
import de.alive.otpfetch.util.LogUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import javax.mail.AuthenticationFailedException;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.Store;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class ImapConnectionManager implements ConnectionManager {

    private static final Duration RETRY_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_RETRY_BACKOFF = Duration.ofSeconds(5);

    private final Configuration configuration;
    private final Properties imapProperties;
    private final Map<Integer, Connection> activeConnections = new HashMap<>();
    private final Object storesLock = new Object();
    private final AtomicInteger connectionIdGenerator = new AtomicInteger(0);

    public ImapConnectionManager(Configuration configuration) {
        this.configuration = configuration;
        this.imapProperties = createImapProperties(configuration.fetchConfig());
    }

    @NotNull
    @Override
    public Mono<IConnection> createConnection() {
        return connectWithRetry()
                .map(store -> {
                    int connectionId = connectionIdGenerator.incrementAndGet();
                    Connection connection = new Connection(store, connectionId);
                    synchronized (storesLock) {
                        activeConnections.put(connectionId, connection);
                    }
                    return (IConnection) connection;
                })
                .doOnSuccess(connection -> log.info("{} IMAP connection {} created for {}",
                        LogUtils.SUCCESS_EMOJI, connection.getId(), LogUtils.maskEmail(configuration.username())))
                .doOnError(error -> log.error("{} Failed to create IMAP connection: {}",
                        LogUtils.ERROR_EMOJI, error.getMessage()));
    }

    @NotNull
    @Override
    public Mono<Boolean> closeConnection(@NotNull IConnection connection) {
        return Mono.fromCallable(() -> {
                    synchronized (storesLock) {
                        return activeConnections.remove(connection.getId()) != null;
                    }
                })
                .flatMap(found -> {
                    if (!found) {
                        log.warn("{} Connection {} not found or already closed",
                                LogUtils.WARNING_EMOJI, connection.getId());
                    }
                    return closeStore(connection.getStore())
                            .doOnSuccess(v -> log.debug("{} Connection {} closed",
                                    LogUtils.SUCCESS_EMOJI, connection.getId()))
                            .thenReturn(found);
                })
                .onErrorResume(error -> {
                    log.error("{} Failed to close connection {}: {}",
                            LogUtils.ERROR_EMOJI, connection.getId(), error.getMessage());
                    return Mono.just(false);
                });
    }

    public int getActiveConnectionCount() {
        synchronized (storesLock) {
            return activeConnections.size();
        }
    }

    private Mono<Void> closeStore(Store store) {
        return Mono.fromRunnable(() -> {
                    if (store != null && store.isConnected()) {
                        try {
                            store.close();
                        } catch (MessagingException e) {
                            log.debug("{} Error closing store: {}", LogUtils.WARNING_EMOJI, e.getMessage());
                        }
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private Mono<Store> connectWithRetry() {
        int maxRetries = configuration.fetchConfig().getMaxConnectRetries();
        return Mono.fromCallable(this::openStore)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(AuthenticationFailedException.class, e -> MailConnectionException.authentication(
                        "IMAP authentication failed for " + LogUtils.maskEmail(configuration.username()), e))
                .onErrorMap(e -> e instanceof MessagingException, e -> new MailConnectionException(
                        "IMAP connection failed: " + e.getMessage(),
                        MailConnectionException.ConnectionStage.CONNECTION_ESTABLISHMENT, e))
                .retryWhen(Retry.backoff(maxRetries, RETRY_BACKOFF)
                        .maxBackoff(MAX_RETRY_BACKOFF)
                        .jitter(0.2)
                        .filter(ImapConnectionManager::isRetryable)
                        .doBeforeRetry(retrySignal ->
                                log.warn("{} IMAP connection attempt {} failed: {}",
                                        LogUtils.WARNING_EMOJI,
                                        retrySignal.totalRetries() + 1,
                                        retrySignal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .doOnSuccess(store -> log.debug("🎯 IMAP connection successful"));
    }

    /**
     * Opens and authenticates a new store. Blocking.
     */
    Store openStore() throws MessagingException {
        Session session = Session.getInstance(imapProperties);
        Store store = session.getStore("imaps");
        store.connect(configuration.username(), configuration.password());
        return store;
    }

    private static boolean isRetryable(Throwable throwable) {
        return throwable instanceof MailConnectionException
                && ((MailConnectionException) throwable).isTransient();
    }

    static Properties createImapProperties(FetchConfiguration config) {
        String timeout = String.valueOf(config.getConnectionTimeout().toMillis());

        Properties props = new Properties();
        props.setProperty("mail.store.protocol", "imaps");
        props.setProperty("mail.imaps.host", config.getHost());
        props.setProperty("mail.imaps.port", String.valueOf(config.getPort()));
        props.setProperty("mail.imaps.ssl.enable", "true");
        props.setProperty("mail.imaps.ssl.checkserveridentity", "true");

        // one socket per store, pooling happens in ConnectionPool
        props.setProperty("mail.imaps.connectionpoolsize", "1");

        props.setProperty("mail.imaps.connectiontimeout", timeout);
        props.setProperty("mail.imaps.timeout", timeout);
        props.setProperty("mail.imaps.writetimeout", timeout);

        // body fetches must not set \Seen
        props.setProperty("mail.imaps.peek", "true");
        props.setProperty("mail.imaps.fetchsize", "16384");
        props.setProperty("mail.imaps.partialfetch", "false");

        return props;
    }

    @Getter
    @AllArgsConstructor
    public static class Connection implements IConnection {

        @NotNull
        private final Store store;
        private final int id;

        @Override
        public boolean isConnected() {
            try {
                return store.isConnected();
            } catch (Exception e) {
                log.debug("Connection check failed for {}: {}", id, e.getMessage());
                return false;
            }
        }
    }
}

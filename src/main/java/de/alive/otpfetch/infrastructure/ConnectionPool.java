package de.alive.otpfetch.infrastructure;

import de.alive.otpfetch.domain.PoolStatistics;
import de.alive.otpfetch.exception.MailConnectionException;
import de.alive.otpfetch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of authenticated sessions. At most {@code maxSize} sessions are live at any time and each
 * leased session belongs to exactly one caller until it is released.
 * <p>
 * The idle deque, the lease map and the live count are guarded by {@link #lock}. Creating, probing and
 * closing sessions happens outside of it.
 */
@Slf4j
public class ConnectionPool {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final ConnectionManager connectionManager;
    private final int maxSize;
    private final Duration idleTimeout;
    private final int maxLeasesPerConnection;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final Deque<PooledConnection> idleConnections = new ArrayDeque<>();
    private final Map<IConnection, PooledConnection> leasedConnections = new HashMap<>();
    private int liveCount;
    private boolean shutdown;

    private final AtomicLong totalCreated = new AtomicLong();
    private final AtomicLong totalReused = new AtomicLong();
    private final AtomicLong totalDiscarded = new AtomicLong();

    public ConnectionPool(@NotNull ConnectionManager connectionManager, int maxSize,
                          @NotNull Duration idleTimeout, int maxLeasesPerConnection) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        if (maxLeasesPerConnection <= 0) {
            throw new IllegalArgumentException("Max leases per connection must be positive");
        }
        this.connectionManager = connectionManager;
        this.maxSize = maxSize;
        this.idleTimeout = idleTimeout;
        this.maxLeasesPerConnection = maxLeasesPerConnection;

        log.info("{} ConnectionPool initialized with max {} connections", LogUtils.PROCESS_EMOJI, maxSize);
    }

    /**
     * Leases a session, waiting up to {@code timeout} when all {@code maxSize} sessions are in use.
     *
     * @throws MailConnectionException {@code POOL_EXHAUSTED} when nothing became available in time,
     *                                 {@code AUTHENTICATION} when a new session was rejected by the server
     */
    @NotNull
    public IConnection acquire(@NotNull Duration timeout) throws MailConnectionException {
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());

        while (true) {
            PooledConnection candidate = null;

            lock.lock();
            try {
                while (true) {
                    if (shutdown) {
                        throw MailConnectionException.poolExhausted("Connection pool is shut down");
                    }

                    candidate = idleConnections.pollLast();
                    if (candidate != null) {
                        leasedConnections.put(candidate.connection, candidate);
                        break;
                    }

                    if (liveCount < maxSize) {
                        liveCount++;
                        break;
                    }

                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw MailConnectionException.poolExhausted(String.format(
                                "No connection available within %dms (%d/%d leased)",
                                timeout.toMillis(), leasedConnections.size(), maxSize));
                    }
                    released.awaitNanos(remaining);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw MailConnectionException.poolExhausted("Interrupted while waiting for a connection");
            } finally {
                lock.unlock();
            }

            if (candidate == null) {
                return createLeased();
            }

            if (isReusable(candidate)) {
                candidate.lease();
                totalReused.incrementAndGet();
                log.debug("Connection {} leased (reuse #{})", candidate.connection.getId(), candidate.leases);
                return candidate.connection;
            }

            log.debug("{} Idle connection {} is stale, discarding", LogUtils.WARNING_EMOJI, candidate.connection.getId());
            discard(candidate);
        }
    }

    /**
     * Returns a leased session. Unhealthy sessions, sessions that served their lease quota and sessions
     * released after shutdown are closed instead of being kept idle.
     */
    public void release(@NotNull IConnection connection, boolean healthy) {
        boolean retire = !healthy || !connection.isConnected();
        PooledConnection pooled;

        lock.lock();
        try {
            pooled = leasedConnections.remove(connection);
            if (pooled == null) {
                log.warn("{} Connection {} was not leased from this pool", LogUtils.WARNING_EMOJI, connection.getId());
                return;
            }

            if (shutdown || retire || pooled.leases >= maxLeasesPerConnection) {
                liveCount--;
            } else {
                pooled.markUsed();
                idleConnections.addLast(pooled);
                pooled = null;
            }
            released.signal();
        } finally {
            lock.unlock();
        }

        if (pooled != null) {
            totalDiscarded.incrementAndGet();
            log.debug("Connection {} retired (healthy={}, leases={})", connection.getId(), healthy, pooled.leases);
            close(connection);
        } else {
            log.debug("Connection {} released", connection.getId());
        }
    }

    /**
     * Opens up to {@code count} sessions ahead of the first request.
     *
     * @return number of sessions created
     * @throws MailConnectionException on authentication failure
     */
    public int initialize(int count) throws MailConnectionException {
        int target = Math.min(count, maxSize);
        log.info("{} Warming up {} connections...", LogUtils.PROCESS_EMOJI, target);

        List<IConnection> opened = new ArrayList<>();
        try {
            for (int i = 0; i < target; i++) {
                try {
                    opened.add(acquire(Duration.ZERO));
                } catch (MailConnectionException e) {
                    if (!e.isRecoverable()) {
                        throw e;
                    }
                    log.warn("{} Warm-up connection {}/{} failed: {}",
                            LogUtils.WARNING_EMOJI, i + 1, target, e.getMessage());
                }
            }
        } finally {
            opened.forEach(connection -> release(connection, true));
        }

        log.info("{} Pool warmed up with {} connections", LogUtils.SUCCESS_EMOJI, opened.size());
        return opened.size();
    }

    /**
     * Closes every idle session and refuses further leases. Leased sessions are closed on release.
     */
    public void shutdown() {
        log.info("{} Shutting down connection pool...", LogUtils.STOP_EMOJI);

        List<PooledConnection> drained;
        lock.lock();
        try {
            shutdown = true;
            drained = new ArrayList<>(idleConnections);
            idleConnections.clear();
            liveCount -= drained.size();
            released.signalAll();
        } finally {
            lock.unlock();
        }

        for (PooledConnection pooled : drained) {
            totalDiscarded.incrementAndGet();
            try {
                connectionManager.closeConnection(pooled.connection).block(CLOSE_TIMEOUT);
            } catch (RuntimeException e) {
                log.warn("{} Failed to close connection {}: {}",
                        LogUtils.WARNING_EMOJI, pooled.connection.getId(), e.getMessage());
            }
        }

        log.info("{} Pool shutdown complete ({} connections closed)", LogUtils.SUCCESS_EMOJI, drained.size());
    }

    @NotNull
    public PoolStatistics getStatistics() {
        lock.lock();
        try {
            return new PoolStatistics(maxSize, liveCount, idleConnections.size(), leasedConnections.size(),
                    totalCreated.get(), totalReused.get(), totalDiscarded.get());
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    private IConnection createLeased() throws MailConnectionException {
        IConnection connection;
        try {
            connection = connectionManager.createConnection().block();
            if (connection == null) {
                throw new MailConnectionException("Connection manager returned no connection",
                        MailConnectionException.ConnectionStage.CONNECTION_ESTABLISHMENT);
            }
        } catch (RuntimeException e) {
            releaseSlot();
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof MailConnectionException) {
                throw (MailConnectionException) cause;
            }
            throw new MailConnectionException("Failed to create connection: " + cause.getMessage(),
                    MailConnectionException.ConnectionStage.CONNECTION_ESTABLISHMENT, cause);
        } catch (MailConnectionException e) {
            releaseSlot();
            throw e;
        }

        PooledConnection pooled = new PooledConnection(connection);
        pooled.lease();

        boolean closeNow = false;
        lock.lock();
        try {
            if (shutdown) {
                liveCount--;
                released.signal();
                closeNow = true;
            } else {
                leasedConnections.put(connection, pooled);
            }
        } finally {
            lock.unlock();
        }

        if (closeNow) {
            close(connection);
            throw MailConnectionException.poolExhausted("Connection pool is shut down");
        }

        totalCreated.incrementAndGet();
        log.debug("Connection {} created and leased", connection.getId());
        return connection;
    }

    private void releaseSlot() {
        lock.lock();
        try {
            liveCount--;
            released.signal();
        } finally {
            lock.unlock();
        }
    }

    private boolean isReusable(PooledConnection pooled) {
        if (pooled.idleMillis() > idleTimeout.toMillis()) {
            return false;
        }
        return pooled.connection.isConnected();
    }

    private void discard(PooledConnection pooled) {
        lock.lock();
        try {
            leasedConnections.remove(pooled.connection);
            liveCount--;
            released.signal();
        } finally {
            lock.unlock();
        }
        totalDiscarded.incrementAndGet();
        close(pooled.connection);
    }

    private void close(IConnection connection) {
        connectionManager.closeConnection(connection)
                .subscribe(
                        closed -> log.debug("Connection {} closed: {}", connection.getId(), closed),
                        error -> log.warn("{} Failed to close connection {}: {}",
                                LogUtils.WARNING_EMOJI, connection.getId(), error.getMessage()));
    }

    private static final class PooledConnection {
        private final IConnection connection;
        private volatile long lastUsedNanos;
        private volatile int leases;

        private PooledConnection(IConnection connection) {
            this.connection = connection;
            this.lastUsedNanos = System.nanoTime();
        }

        private void lease() {
            leases++;
            markUsed();
        }

        private void markUsed() {
            lastUsedNanos = System.nanoTime();
        }

        private long idleMillis() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastUsedNanos);
        }
    }
}

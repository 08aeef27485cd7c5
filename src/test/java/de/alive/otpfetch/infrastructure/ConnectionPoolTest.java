package de.alive.otpfetch.infrastructure;

import de.alive.otpfetch.domain.PoolStatistics;
import de.alive.otpfetch.exception.MailConnectionException;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import javax.mail.AuthenticationFailedException;
import javax.mail.Store;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ConnectionPoolTest {

    private FakeConnectionManager manager;
    private ConnectionPool pool;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        manager = new FakeConnectionManager();
        pool = new ConnectionPool(manager, 2, Duration.ofMinutes(5), 3);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        pool.shutdown();
    }

    @Test
    void testReusesReleasedConnection() throws Exception {
        IConnection first = pool.acquire(Duration.ofSeconds(1));
        pool.release(first, true);

        IConnection second = pool.acquire(Duration.ofSeconds(1));

        assertSame(first, second);
        assertEquals(1, manager.created.get());
        assertEquals(1, pool.getStatistics().totalReused());
    }

    @Test
    void testNeverExceedsMaxSize() throws Exception {
        IConnection a = pool.acquire(Duration.ofSeconds(1));
        IConnection b = pool.acquire(Duration.ofSeconds(1));

        assertNotSame(a, b);
        MailConnectionException error = assertThrows(MailConnectionException.class,
                () -> pool.acquire(Duration.ofMillis(50)));
        assertEquals(MailConnectionException.ConnectionStage.POOL_EXHAUSTED, error.getStage());
        assertEquals(2, manager.created.get());
    }

    @Test
    void testWaitingAcquireWakesOnRelease() throws Exception {
        IConnection a = pool.acquire(Duration.ofSeconds(1));
        pool.acquire(Duration.ofSeconds(1));

        Future<IConnection> waiting = executor.submit(() -> pool.acquire(Duration.ofSeconds(5)));
        Thread.sleep(100);
        assertFalse(waiting.isDone());

        pool.release(a, true);

        assertSame(a, waiting.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testUnhealthyConnectionIsDiscarded() throws Exception {
        IConnection first = pool.acquire(Duration.ofSeconds(1));
        pool.release(first, false);

        IConnection second = pool.acquire(Duration.ofSeconds(1));

        assertNotSame(first, second);
        assertTrue(manager.closed.contains(first));
        assertEquals(1, pool.getStatistics().totalDiscarded());
    }

    @Test
    void testDisconnectedIdleConnectionIsReplaced() throws Exception {
        FakeConnection first = (FakeConnection) pool.acquire(Duration.ofSeconds(1));
        pool.release(first, true);
        first.connected = false;

        IConnection second = pool.acquire(Duration.ofSeconds(1));

        assertNotSame(first, second);
        assertEquals(2, manager.created.get());
    }

    @Test
    void testConnectionRetiredAfterLeaseLimit() throws Exception {
        IConnection first = null;
        for (int i = 0; i < 3; i++) {
            IConnection connection = pool.acquire(Duration.ofSeconds(1));
            if (first == null) {
                first = connection;
            }
            assertSame(first, connection);
            pool.release(connection, true);
        }

        IConnection fourth = pool.acquire(Duration.ofSeconds(1));

        assertNotSame(first, fourth);
        assertTrue(manager.closed.contains(first));
    }

    @Test
    void testAuthenticationFailurePropagatesAndFreesSlot() {
        manager.failure = MailConnectionException.authentication("bad credentials",
                new AuthenticationFailedException("[AUTHENTICATIONFAILED]"));

        MailConnectionException error = assertThrows(MailConnectionException.class,
                () -> pool.acquire(Duration.ofSeconds(1)));

        assertEquals(MailConnectionException.ConnectionStage.AUTHENTICATION, error.getStage());
        assertEquals(0, pool.getStatistics().live());
    }

    @Test
    void testStatisticsStayConsistent() throws Exception {
        IConnection a = pool.acquire(Duration.ofSeconds(1));
        IConnection b = pool.acquire(Duration.ofSeconds(1));
        pool.release(a, true);

        PoolStatistics stats = pool.getStatistics();
        assertEquals(2, stats.live());
        assertEquals(1, stats.idle());
        assertEquals(1, stats.leased());
        assertEquals(stats.live(), stats.idle() + stats.leased());

        pool.release(b, false);
        stats = pool.getStatistics();
        assertEquals(1, stats.live());
        assertEquals(stats.live(), stats.idle() + stats.leased());
    }

    @Test
    void testInitializeOpensConnectionsAndKeepsThemIdle() throws Exception {
        assertEquals(2, pool.initialize(5));

        PoolStatistics stats = pool.getStatistics();
        assertEquals(2, stats.idle());
        assertEquals(0, stats.leased());
    }

    @Test
    void testShutdownClosesIdleAndRefusesLeases() throws Exception {
        IConnection a = pool.acquire(Duration.ofSeconds(1));
        IConnection b = pool.acquire(Duration.ofSeconds(1));
        pool.release(a, true);

        pool.shutdown();

        assertTrue(pool.isShutdown());
        assertTrue(manager.closed.contains(a));
        assertThrows(MailConnectionException.class, () -> pool.acquire(Duration.ofMillis(10)));

        pool.release(b, true);
        assertTrue(manager.closed.contains(b));
        assertEquals(0, pool.getStatistics().live());
    }

    @Test
    void testReleaseOfForeignConnectionIsIgnored() {
        pool.release(new FakeConnection(99), true);

        assertEquals(0, pool.getStatistics().live());
    }

    private static final class FakeConnection implements IConnection {
        private final int id;
        private final Store store = mock(Store.class);
        private volatile boolean connected = true;

        private FakeConnection(int id) {
            this.id = id;
        }

        @Override
        public int getId() {
            return id;
        }

        @NotNull
        @Override
        public Store getStore() {
            return store;
        }

        @Override
        public boolean isConnected() {
            return connected;
        }
    }

    private static final class FakeConnectionManager implements ConnectionManager {
        private final AtomicInteger created = new AtomicInteger();
        private final List<IConnection> closed = new CopyOnWriteArrayList<>();
        private volatile MailConnectionException failure;

        @NotNull
        @Override
        public Mono<IConnection> createConnection() {
            if (failure != null) {
                return Mono.error(failure);
            }
            return Mono.fromCallable(() -> new FakeConnection(created.incrementAndGet()));
        }

        @NotNull
        @Override
        public Mono<Boolean> closeConnection(@NotNull IConnection connection) {
            return Mono.fromCallable(() -> {
                closed.add(connection);
                ((FakeConnection) connection).connected = false;
                return true;
            });
        }
    }
}

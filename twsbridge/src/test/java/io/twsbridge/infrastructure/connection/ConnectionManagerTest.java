package io.twsbridge.infrastructure.connection;

import io.twsbridge.config.ClientConfig;
import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.ManagedAccountsEvent;
import io.twsbridge.domain.event.NextValidIdEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.event.TickPriceEvent;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.domain.request.MarketDataRequest;
import io.twsbridge.infrastructure.wire.RequestEncoder;
import io.twsbridge.testing.FakeGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.ServerSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConnectionManager against an in-process gateway.
 *
 * Tests:
 * - Handshake success and each connect failure reason
 * - Frame delivery and tolerance of undecodable frames
 * - Decoding against the negotiated server version
 * - Reconnect with exactly one replay of each subscription
 * - A stale reconnect loop never replaces a newer session
 * - Heartbeat timeout and orderly disconnect
 */
class ConnectionManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeGateway gateway;
    private ConnectionManager manager;
    private List<InboundEvent> events;

    @BeforeEach
    void setUp() throws IOException {
        gateway = new FakeGateway();
        events = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        if (manager != null) {
            manager.close();
        }
        gateway.close();
    }

    private ClientConfig.Builder config() {
        return ClientConfig.builder()
            .host("127.0.0.1")
            .port(gateway.port())
            .clientId(7)
            .connectTimeout(Duration.ofSeconds(2))
            .reconnectInitialDelay(Duration.ofMillis(50))
            .reconnectMaxDelay(Duration.ofMillis(200))
            .reconnectMaxAttempts(5);
    }

    private ConnectionManager start(ClientConfig config) {
        manager = new ConnectionManager(config, events::add);
        return manager;
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HANDSHAKE
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testHandshakeSuccess() throws Exception {
        ConnectionInfo info = start(config().build()).connect();

        assertEquals(176, info.serverVersion());
        assertEquals(FakeGateway.CONNECTION_TIME, info.connectionTime());
        assertEquals(1000, info.nextValidId());
        assertEquals("127.0.0.1:" + gateway.port() + "/7", info.sessionLabel());
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertSame(info, manager.getConnectionInfo());

        FakeGateway.Connection connection = gateway.awaitConnection(0, WAIT);
        assertEquals(List.of("v100..176"), connection.versionRange());
        assertEquals(List.of("71", "2", "7", ""), connection.frames().get(0), "START_API with client id");

        assertTrue(events.contains(new NextValidIdEvent(1000)), "Handshake events reach the sink");
        assertTrue(events.stream().anyMatch(e -> e instanceof ManagedAccountsEvent));
    }

    @Test
    void testVersionMismatch() {
        gateway.serverVersion(99);

        TwsConnectException error = assertThrows(TwsConnectException.class, () -> start(config().build()).connect());

        assertEquals(TwsConnectException.Reason.VERSION_MISMATCH, error.getReason());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    void testRefused() throws IOException {
        int port = closedPort();

        TwsConnectException error = assertThrows(TwsConnectException.class,
            () -> start(config().port(port).build()).connect());

        assertEquals(TwsConnectException.Reason.REFUSED, error.getReason());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    void testHandshakeTimeout() {
        gateway.silent();
        ConnectionManager silentManager = start(config().build());

        long started = System.nanoTime();
        TwsConnectException error = assertThrows(TwsConnectException.class,
            () -> silentManager.connect("127.0.0.1", gateway.port(), 7, Duration.ofMillis(300)));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(TwsConnectException.Reason.TIMEOUT, error.getReason());
        assertTrue(elapsedMs < 2000, "Bounded by the connect timeout, took " + elapsedMs + "ms");
    }

    @Test
    void testSecondConnectRejected() {
        start(config().build()).connect();

        assertThrows(IllegalStateException.class, () -> manager.connect());
    }

    @Test
    void testSendWithoutSession() {
        ConnectionManager idle = start(config().build());

        assertThrows(ConnectionLostException.class, () -> idle.send(new byte[]{0, 0, 0, 0}));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // READING
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testFramesDeliveredInOrder() throws Exception {
        start(config().build()).connect();
        FakeGateway.Connection connection = gateway.awaitConnection(0, WAIT);

        for (int i = 0; i < 10; i++) {
            connection.send(1, 6, 4, 4, 600 + i, 1, 0);
        }

        List<TickPriceEvent> ticks = awaitTicks(10);
        assertEquals(List.of(600, 601, 602, 603, 604, 605, 606, 607, 608, 609),
            ticks.stream().map(t -> t.price().intValue()).collect(Collectors.toList()));
    }

    @Test
    void testUndecodableFrameSkipped() throws Exception {
        start(config().build()).connect();
        FakeGateway.Connection connection = gateway.awaitConnection(0, WAIT);

        connection.send(1, 6, "x", 4, 600, 1, 0);
        connection.send(1, 6, 4, 4, 601, 1, 0);

        List<TickPriceEvent> ticks = awaitTicks(1);
        assertEquals(new BigDecimal("601"), ticks.get(0).price());
        assertTrue(manager.isConnected(), "One bad frame does not drop the session");
    }

    @Test
    void testCorruptStreamDropsSession() throws Exception {
        CountDownLatch lost = new CountDownLatch(1);
        start(config().autoReconnect(false).build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String reason) {
                lost.countDown();
            }
        });
        manager.connect();

        gateway.awaitConnection(0, WAIT).write(ByteBuffer.allocate(4).putInt(0x7FFFFFFF).array());

        assertTrue(lost.await(5, TimeUnit.SECONDS));
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    void testOlderServerVersionDecodesVersionedLayouts() throws Exception {
        gateway.serverVersion(130);
        ConnectionInfo info = start(config().build()).connect();
        FakeGateway.Connection connection = gateway.awaitConnection(0, WAIT);

        // below 131 ORDER_STATUS still carries its version field
        connection.send(3, 6, 1001, "Filled", 100, 0, "10.5", 77, 0, "10.5", 7, "");

        long deadline = System.nanoTime() + WAIT.toNanos();
        OrderStatusEvent status = null;
        while (status == null && System.nanoTime() < deadline) {
            status = events.stream()
                .filter(e -> e instanceof OrderStatusEvent)
                .map(e -> (OrderStatusEvent) e)
                .findFirst()
                .orElse(null);
            Thread.sleep(10);
        }

        assertEquals(130, info.serverVersion());
        assertEquals(130, manager.serverVersion(), "Encoders see the negotiated version");
        assertNotNull(status, "Order status decoded, events: " + events);
        assertEquals(1001, status.orderId());
        assertEquals("Filled", status.status());
        assertEquals(0, new BigDecimal("100").compareTo(status.filled()));
    }

    private List<TickPriceEvent> awaitTicks(int count) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            List<TickPriceEvent> ticks = events.stream()
                .filter(e -> e instanceof TickPriceEvent)
                .map(e -> (TickPriceEvent) e)
                .collect(Collectors.toList());
            if (ticks.size() >= count) {
                return ticks;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Expected " + count + " ticks, got " + events);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RECONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testReconnectReplaysSubscriptionsOnce() throws Exception {
        List<ClientRequest> active = List.of(
            new MarketDataRequest(5, Contract.stock("GOOG"), "", false),
            new MarketDataRequest(6, Contract.stock("AAPL"), "", false));
        CountDownLatch lost = new CountDownLatch(1);
        CountDownLatch reconnected = new CountDownLatch(1);

        start(config().build());
        manager.setResubscriptionSource(() -> active);
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String reason) {
                lost.countDown();
            }

            @Override
            public void onReconnected(ConnectionInfo info) {
                reconnected.countDown();
            }
        });
        manager.connect();
        RequestEncoder encoder = new RequestEncoder();
        for (ClientRequest request : active) {
            manager.send(encoder.encode(request, manager.serverVersion()));
        }
        gateway.awaitConnection(0, WAIT).awaitFrame(f -> f.get(0).equals("1") && f.get(2).equals("6"), WAIT);

        gateway.dropConnections();

        assertTrue(lost.await(5, TimeUnit.SECONDS), "Loss detected");
        assertTrue(reconnected.await(5, TimeUnit.SECONDS), "Reconnected");
        FakeGateway.Connection second = gateway.awaitConnection(1, WAIT);
        second.awaitFrame(f -> f.get(0).equals("1") && f.get(2).equals("6"), WAIT);
        Thread.sleep(200);

        List<String> replayedIds = second.frames(1).stream()
            .map(f -> f.get(2))
            .collect(Collectors.toList());
        assertEquals(List.of("5", "6"), replayedIds, "Each subscription replayed exactly once under its id");
        assertEquals(ConnectionState.CONNECTED, manager.getState());
    }

    @Test
    void testCycleReconnects() throws Exception {
        CountDownLatch reconnected = new CountDownLatch(1);
        start(config().build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onReconnected(ConnectionInfo info) {
                reconnected.countDown();
            }
        });
        manager.connect();

        manager.cycle();

        assertTrue(reconnected.await(5, TimeUnit.SECONDS));
        assertEquals(2, gateway.connections().size());
        assertTrue(manager.isConnected());
    }

    @Test
    void testGivesUpAfterMaxAttempts() throws Exception {
        CountDownLatch failed = new CountDownLatch(1);
        AtomicReference<Integer> attempts = new AtomicReference<>();
        start(config().reconnectMaxAttempts(2).build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onReconnectFailed(int count) {
                attempts.set(count);
                failed.countDown();
            }
        });
        manager.connect();

        gateway.close();

        assertTrue(failed.await(5, TimeUnit.SECONDS));
        assertEquals(2, attempts.get());
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
    }

    @Test
    void testNoReconnectWhenDisabled() throws Exception {
        CountDownLatch lost = new CountDownLatch(1);
        start(config().autoReconnect(false).build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String reason) {
                lost.countDown();
            }
        });
        manager.connect();

        gateway.dropConnections();

        assertTrue(lost.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(1, gateway.connections().size());
    }

    @Test
    void testDisconnectIsFinal() throws Exception {
        CountDownLatch disconnected = new CountDownLatch(1);
        start(config().build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onDisconnected() {
                disconnected.countDown();
            }
        });
        manager.connect();

        manager.disconnect();

        assertTrue(disconnected.await(1, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(ConnectionState.DISCONNECTED, manager.getState());
        assertEquals(1, gateway.connections().size(), "No reconnect after a user disconnect");
        assertThrows(ConnectionLostException.class, () -> manager.send(new byte[]{0, 0, 0, 0}));
    }

    @Test
    void testStaleReconnectDoesNotReplaceNewSession() throws Exception {
        CountDownLatch lost = new CountDownLatch(1);
        start(config()
            .reconnectInitialDelay(Duration.ofMillis(500))
            .reconnectMaxDelay(Duration.ofMillis(500))
            .build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String reason) {
                lost.countDown();
            }
        });
        manager.connect();

        gateway.dropConnections();
        assertTrue(lost.await(5, TimeUnit.SECONDS), "Loss detected");
        assertEquals(ConnectionState.RECONNECTING, manager.getState());

        // user takes over while the reconnect loop is still backing off
        manager.disconnect();
        ConnectionInfo info = manager.connect();
        Thread.sleep(1000);

        assertEquals(2, gateway.connections().size(), "The backoff loop opened no session of its own");
        assertEquals(ConnectionState.CONNECTED, manager.getState());
        assertSame(info, manager.getConnectionInfo(), "Session of the explicit connect stays current");

        manager.send(new RequestEncoder().encode(new MarketDataRequest(9, Contract.stock("IBM"), "", false),
            manager.serverVersion()));
        gateway.awaitConnection(1, WAIT).awaitFrame(f -> f.get(0).equals("1") && f.get(2).equals("9"), WAIT);
    }

    @Test
    void testHeartbeatTimeout() throws Exception {
        gateway.answerCurrentTime(false);
        CountDownLatch lost = new CountDownLatch(1);
        AtomicReference<String> reason = new AtomicReference<>();
        start(config()
            .autoReconnect(false)
            .heartbeatInterval(Duration.ofMillis(100))
            .heartbeatTimeout(Duration.ofMillis(300))
            .build());
        manager.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String why) {
                reason.set(why);
                lost.countDown();
            }
        });
        manager.connect();

        assertTrue(lost.await(5, TimeUnit.SECONDS), "Silent gateway detected");
        assertEquals("Heartbeat timeout", reason.get());
        assertFalse(gateway.latest().frames(49).isEmpty(), "Pings were sent");
    }

    @Test
    void testAnsweredHeartbeatKeepsSession() throws Exception {
        start(config()
            .heartbeatInterval(Duration.ofMillis(100))
            .heartbeatTimeout(Duration.ofMillis(300))
            .build());
        manager.connect();

        Thread.sleep(800);

        assertTrue(manager.isConnected());
        assertEquals(1, gateway.connections().size());
    }
}

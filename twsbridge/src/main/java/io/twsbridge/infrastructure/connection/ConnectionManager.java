package io.twsbridge.infrastructure.connection;

import io.twsbridge.config.ClientConfig;
import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.NextValidIdEvent;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.domain.request.CurrentTimeRequest;
import io.twsbridge.domain.request.StartApiRequest;
import io.twsbridge.infrastructure.common.HeartbeatManager;
import io.twsbridge.infrastructure.common.ReconnectionPolicy;
import io.twsbridge.infrastructure.metrics.ClientMetrics;
import io.twsbridge.infrastructure.wire.DecodeResult;
import io.twsbridge.infrastructure.wire.EncodingException;
import io.twsbridge.infrastructure.wire.ProtocolException;
import io.twsbridge.infrastructure.wire.ProtocolVersion;
import io.twsbridge.infrastructure.wire.RequestEncoder;
import io.twsbridge.infrastructure.wire.WireDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the socket to the gateway.
 *
 * Responsibilities:
 * - Handshake (API sign, version range, START_API, wait for NEXT_VALID_ID)
 * - Serialized writes through one lock
 * - A daemon reader thread per session that decodes frames and hands events to the sink
 * - Heartbeat with a current-time ping; any inbound frame counts as a pong
 * - Reconnect with exponential backoff and replay of active subscriptions
 *
 * Events are delivered to the sink on the reader thread, in decode order.
 * The sink must not block.
 *
 * Every connect and disconnect starts a new epoch. A reconnect loop or a
 * handshake that belongs to an older epoch can never install its session.
 */
public class ConnectionManager implements FrameSender, SessionCycler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final int READ_BUFFER_SIZE = 8192;

    private final ClientConfig config;
    private final Consumer<InboundEvent> eventSink;
    private final RequestEncoder encoder = new RequestEncoder();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Object lifecycleLock = new Object();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService reconnectExecutor;

    // guarded by lifecycleLock
    private long epoch;
    private Future<?> reconnectTask;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Session current;
    private volatile ConnectionInfo lastInfo;
    private volatile ResubscriptionSource resubscriptionSource = List::of;
    private volatile ClientMetrics metrics;
    private volatile boolean userDisconnect;
    private volatile boolean closed;

    private volatile String host;
    private volatile int port;
    private volatile int clientId;
    private volatile Duration connectTimeout;

    public ConnectionManager(ClientConfig config, Consumer<InboundEvent> eventSink) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (eventSink == null) {
            throw new IllegalArgumentException("Event sink cannot be null");
        }
        this.config = config;
        this.eventSink = eventSink;
        this.host = config.host();
        this.port = config.port();
        this.clientId = config.clientId();
        this.connectTimeout = config.connectTimeout();
        this.reconnectExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tws-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ═══════════════════════════════════════════════════════════════════════

    public void setMetrics(ClientMetrics metrics) {
        this.metrics = metrics;
    }

    public void setResubscriptionSource(ResubscriptionSource source) {
        this.resubscriptionSource = source != null ? source : List::of;
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Connect using the configured host, port, client id and timeout.
     */
    public ConnectionInfo connect() {
        return connect(config.host(), config.port(), config.clientId(), config.connectTimeout());
    }

    /**
     * Open a session and block until the gateway reports the next valid order id.
     *
     * @throws TwsConnectException REFUSED, TIMEOUT or VERSION_MISMATCH
     * @throws IllegalStateException if a session is already open or being opened
     */
    public ConnectionInfo connect(String host, int port, int clientId, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Connect timeout must be positive");
        }
        long attemptEpoch;
        synchronized (lifecycleLock) {
            if (closed) {
                throw new IllegalStateException("Connection manager is closed");
            }
            if (state != ConnectionState.DISCONNECTED) {
                throw new IllegalStateException("[" + getSessionLabel() + "] Cannot connect while " + state);
            }
            this.host = host;
            this.port = port;
            this.clientId = clientId;
            this.connectTimeout = timeout;
            this.userDisconnect = false;
            this.state = ConnectionState.CONNECTING;
            attemptEpoch = ++epoch;
        }

        log.info("[TWS:{}] Connecting (timeout={}ms)", getSessionLabel(), timeout.toMillis());

        Session session;
        try {
            session = openSession();
        } catch (TwsConnectException e) {
            synchronized (lifecycleLock) {
                if (epoch == attemptEpoch && state == ConnectionState.CONNECTING) {
                    state = ConnectionState.DISCONNECTED;
                }
            }
            throw e;
        }

        ConnectionInfo info = activate(session, attemptEpoch);
        if (info == null) {
            throw new TwsConnectException(getSessionLabel(), TwsConnectException.Reason.REFUSED,
                "Connection attempt superseded by disconnect");
        }
        if (metrics != null) {
            metrics.recordConnectionEvent(info.sessionLabel(), "CONNECTED");
        }
        notifyListeners(l -> l.onConnected(info));
        return info;
    }

    /**
     * Orderly close. No reconnection follows.
     */
    public void disconnect() {
        Session session;
        synchronized (lifecycleLock) {
            userDisconnect = true;
            epoch++;
            cancelReconnect();
            session = current;
            current = null;
            if (state == ConnectionState.DISCONNECTED && session == null) {
                return;
            }
            state = ConnectionState.DISCONNECTED;
            if (session != null) {
                closeSession(session);
            }
        }

        log.info("[TWS:{}] Disconnected", getSessionLabel());
        if (metrics != null) {
            metrics.recordConnectionEvent(getSessionLabel(), "DISCONNECTED");
            metrics.setConnected(getSessionLabel(), false);
        }
        notifyListeners(ConnectionListener::onDisconnected);
    }

    /**
     * Close the session and reconnect in the background, replaying subscriptions.
     * Requests in flight fail as on a connection loss.
     */
    @Override
    public void cycle() {
        Session session;
        synchronized (lifecycleLock) {
            session = current;
            if (session == null || state != ConnectionState.CONNECTED) {
                log.debug("[TWS:{}] Cycle skipped (state={})", getSessionLabel(), state);
                return;
            }
            closeSession(session);
            current = null;
            state = ConnectionState.RECONNECTING;
        }

        log.info("[TWS:{}] Cycling session", getSessionLabel());
        if (metrics != null) {
            metrics.recordConnectionEvent(getSessionLabel(), "CYCLED");
            metrics.setConnected(getSessionLabel(), false);
        }
        notifyListeners(l -> l.onConnectionLost("Session cycle"));
        scheduleReconnect();
    }

    @Override
    public void close() {
        closed = true;
        disconnect();
        reconnectExecutor.shutdownNow();
        try {
            reconnectExecutor.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SENDING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Write one frame. Concurrent callers are serialized; frames never interleave.
     *
     * @throws ConnectionLostException unless CONNECTED, or when the write fails
     */
    @Override
    public void send(byte[] frame) {
        Session session = current;
        if (session == null || state != ConnectionState.CONNECTED) {
            throw new ConnectionLostException(getSessionLabel(), "Not connected (state=" + state + ")");
        }

        IOException failure = null;
        writeLock.lock();
        try {
            session.out.write(frame);
            session.out.flush();
        } catch (IOException e) {
            failure = e;
        } finally {
            writeLock.unlock();
        }

        if (failure != null) {
            handleLoss(session, "Write failed: " + failure.getMessage());
            throw new ConnectionLostException(getSessionLabel(), "Write failed", failure);
        }
    }

    /**
     * Version negotiated by the current or most recent session. Before the first
     * handshake, the highest version this client speaks.
     */
    @Override
    public int serverVersion() {
        ConnectionInfo info = lastInfo;
        return info != null ? info.serverVersion() : ProtocolVersion.MAX_CLIENT_VERSION;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════════════

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * @return handshake facts of the current or most recent session, or null
     */
    public ConnectionInfo getConnectionInfo() {
        return lastInfo;
    }

    public String getSessionLabel() {
        return ConnectionInfo.sessionLabel(host, port, clientId);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HANDSHAKE
    // ═══════════════════════════════════════════════════════════════════════

    private Session openSession() {
        String label = getSessionLabel();
        long deadline = System.nanoTime() + connectTimeout.toNanos();
        Socket socket = new Socket();

        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1, connectTimeout.toMillis()));
        } catch (SocketTimeoutException e) {
            closeQuietly(socket);
            throw connectFailure(label, TwsConnectException.Reason.TIMEOUT,
                "Connect timed out after " + connectTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            closeQuietly(socket);
            throw connectFailure(label, TwsConnectException.Reason.REFUSED, "Connection refused: " + e.getMessage(), e);
        }

        try {
            InputStream in = socket.getInputStream();
            OutputStream out = socket.getOutputStream();
            WireDecoder decoder = new WireDecoder();
            byte[] buffer = new byte[READ_BUFFER_SIZE];

            out.write(encoder.handshake());
            out.flush();

            List<String> reply = readHandshakeReply(label, socket, in, decoder, buffer, deadline);
            int serverVersion = parseServerVersion(label, reply);
            if (!ProtocolVersion.isSupported(serverVersion)) {
                throw connectFailure(label, TwsConnectException.Reason.VERSION_MISMATCH,
                    "Server version " + serverVersion + " outside supported range " + ProtocolVersion.versionRange(), null);
            }
            decoder.setServerVersion(serverVersion);
            String connectionTime = reply.size() > 1 ? reply.get(1) : "";
            log.debug("[TWS:{}] Server version {} (connection time {})", label, serverVersion, connectionTime);

            out.write(encoder.encode(new StartApiRequest(clientId, ""), serverVersion));
            out.flush();

            List<InboundEvent> early = new ArrayList<>();
            long nextValidId = awaitNextValidId(label, socket, in, decoder, buffer, deadline, early);
            socket.setSoTimeout(0);

            ConnectionInfo info = new ConnectionInfo(host, port, clientId, serverVersion, connectionTime,
                nextValidId, Instant.now());
            return new Session(socket, in, out, decoder, info, early);

        } catch (TwsConnectException e) {
            closeQuietly(socket);
            throw e;
        } catch (SocketTimeoutException e) {
            closeQuietly(socket);
            throw connectFailure(label, TwsConnectException.Reason.TIMEOUT,
                "Handshake timed out after " + connectTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            closeQuietly(socket);
            throw connectFailure(label, TwsConnectException.Reason.REFUSED, "Handshake failed: " + e.getMessage(), e);
        }
    }

    private List<String> readHandshakeReply(String label, Socket socket, InputStream in, WireDecoder decoder,
                                            byte[] buffer, long deadline) throws IOException {
        while (true) {
            List<String> fields;
            try {
                fields = decoder.nextRawFrame();
            } catch (ProtocolException e) {
                throw connectFailure(label, TwsConnectException.Reason.REFUSED,
                    "Malformed handshake reply: " + e.getMessage(), e);
            }
            if (fields != null) {
                return fields;
            }
            readWithDeadline(label, socket, in, decoder, buffer, deadline, null);
        }
    }

    private long awaitNextValidId(String label, Socket socket, InputStream in, WireDecoder decoder,
                                  byte[] buffer, long deadline, List<InboundEvent> early) throws IOException {
        ErrorEvent lastError = null;
        while (true) {
            DecodeResult result;
            try {
                result = decoder.next();
            } catch (ProtocolException e) {
                if (e.isStreamCorrupt()) {
                    throw connectFailure(label, TwsConnectException.Reason.REFUSED,
                        "Corrupt stream during handshake: " + e.getMessage(), e);
                }
                log.warn("[TWS:{}] Skipping undecodable frame during handshake: {}", label, e.getMessage());
                continue;
            }

            if (result.needsMoreBytes()) {
                readWithDeadline(label, socket, in, decoder, buffer, deadline, lastError);
                continue;
            }

            InboundEvent event = result.event();
            early.add(event);
            if (event instanceof ErrorEvent && !((ErrorEvent) event).isWarning()) {
                lastError = (ErrorEvent) event;
            }
            if (event instanceof NextValidIdEvent) {
                return ((NextValidIdEvent) event).orderId();
            }
        }
    }

    private void readWithDeadline(String label, Socket socket, InputStream in, WireDecoder decoder,
                                  byte[] buffer, long deadline, ErrorEvent lastError) throws IOException {
        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMillis <= 0) {
            throw connectFailure(label, TwsConnectException.Reason.TIMEOUT,
                "Handshake timed out after " + connectTimeout.toMillis() + "ms", null);
        }
        socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
        int n = in.read(buffer);
        if (n < 0) {
            String detail = lastError != null
                ? " (gateway error " + lastError.code() + ": " + lastError.message() + ")"
                : "";
            throw connectFailure(label, TwsConnectException.Reason.REFUSED,
                "Gateway closed the connection during handshake" + detail, null);
        }
        decoder.feed(buffer, 0, n);
    }

    private int parseServerVersion(String label, List<String> reply) {
        if (reply.isEmpty()) {
            throw connectFailure(label, TwsConnectException.Reason.REFUSED, "Empty handshake reply", null);
        }
        try {
            return Integer.parseInt(reply.get(0).trim());
        } catch (NumberFormatException e) {
            throw connectFailure(label, TwsConnectException.Reason.REFUSED,
                "Handshake reply is not a server version: '" + reply.get(0) + "'", e);
        }
    }

    private TwsConnectException connectFailure(String label, TwsConnectException.Reason reason,
                                               String message, Throwable cause) {
        if (metrics != null) {
            metrics.recordConnectFailure(label, reason.name());
        }
        return cause != null
            ? new TwsConnectException(label, reason, message, cause)
            : new TwsConnectException(label, reason, message);
    }

    /**
     * Install a handshaken session: deliver the events read during the handshake,
     * then start the reader thread and the heartbeat.
     *
     * @return null when the attempt's epoch has passed; the session is closed
     */
    private ConnectionInfo activate(Session session, long attemptEpoch) {
        String label = session.info.sessionLabel();
        synchronized (lifecycleLock) {
            boolean opening = state == ConnectionState.CONNECTING || state == ConnectionState.RECONNECTING;
            if (closed || epoch != attemptEpoch || !opening) {
                closeSession(session);
                log.info("[TWS:{}] Discarding superseded session (state={})", label, state);
                return null;
            }
            current = session;
            lastInfo = session.info;
            state = ConnectionState.CONNECTED;
            // a loss of this session may start a new loop while the old one unwinds
            reconnectTask = null;
        }

        log.info("[TWS:{}] Connected (server version {}, next order id {})",
            label, session.info.serverVersion(), session.info.nextValidId());
        if (metrics != null) {
            metrics.setConnected(label, true);
        }

        for (InboundEvent event : session.early) {
            deliver(event);
        }

        session.heartbeat = new HeartbeatManager(
            label,
            config.heartbeatInterval(),
            config.heartbeatTimeout(),
            () -> ping(session),
            healthy -> {
                if (!healthy) {
                    handleLoss(session, "Heartbeat timeout");
                }
            });
        if (session.closed) {
            session.heartbeat.stop();
            return session.info;
        }

        Thread reader = new Thread(() -> readLoop(session), "tws-reader-" + label);
        reader.setDaemon(true);
        reader.start();
        session.heartbeat.start();

        return session.info;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // READER
    // ═══════════════════════════════════════════════════════════════════════

    private void readLoop(Session session) {
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try {
            drain(session);
            while (!session.closed) {
                int n = session.in.read(buffer);
                if (n < 0) {
                    handleLoss(session, "Gateway closed the connection");
                    return;
                }
                session.decoder.feed(buffer, 0, n);
                drain(session);
            }
        } catch (IOException e) {
            if (!session.closed) {
                handleLoss(session, "Read failed: " + e.getMessage());
            }
        } catch (ProtocolException e) {
            log.error("[TWS:{}] Inbound stream unusable: {}", session.info.sessionLabel(), e.getMessage());
            handleLoss(session, e.getMessage());
        }
    }

    private void drain(Session session) {
        while (!session.closed) {
            DecodeResult result;
            try {
                result = session.decoder.next();
            } catch (ProtocolException e) {
                if (e.isStreamCorrupt()) {
                    throw e;
                }
                session.protocolErrors++;
                if (metrics != null) {
                    metrics.recordProtocolError();
                }
                log.warn("[TWS:{}] Skipping undecodable frame ({} consecutive): {} fields={}",
                    session.info.sessionLabel(), session.protocolErrors, e.getMessage(), e.getFields());
                if (session.protocolErrors >= config.protocolErrorThreshold()) {
                    throw ProtocolException.streamCorrupt(
                        session.protocolErrors + " consecutive undecodable frames");
                }
                continue;
            }

            if (result.needsMoreBytes()) {
                return;
            }
            session.protocolErrors = 0;
            session.heartbeat.recordPong();
            deliver(result.event());
        }
    }

    private void deliver(InboundEvent event) {
        if (metrics != null) {
            metrics.recordFrameReceived(event.getClass().getSimpleName());
        }
        try {
            eventSink.accept(event);
        } catch (RuntimeException e) {
            log.error("[TWS:{}] Event handler failed for {}", getSessionLabel(), event, e);
        }
    }

    private void ping(Session session) {
        if (current != session) {
            return;
        }
        send(encoder.encode(new CurrentTimeRequest(), session.info.serverVersion()));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // RECONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    private void handleLoss(Session session, String reason) {
        boolean reconnect;
        synchronized (lifecycleLock) {
            if (session.closed || current != session) {
                return;
            }
            closeSession(session);
            current = null;
            if (userDisconnect) {
                return;
            }
            reconnect = config.autoReconnect() && !closed;
            state = reconnect ? ConnectionState.RECONNECTING : ConnectionState.DISCONNECTED;
        }

        String label = session.info.sessionLabel();
        log.warn("[TWS:{}] Connection lost: {}", label, reason);
        if (metrics != null) {
            metrics.recordConnectionEvent(label, "LOST");
            metrics.setConnected(label, false);
        }
        notifyListeners(l -> l.onConnectionLost(reason));

        if (reconnect) {
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        synchronized (lifecycleLock) {
            if (closed || state != ConnectionState.RECONNECTING) {
                return;
            }
            if (reconnectTask != null && !reconnectTask.isDone()) {
                return;
            }
            long loopEpoch = epoch;
            try {
                reconnectTask = reconnectExecutor.submit(() -> reconnectLoop(loopEpoch));
            } catch (RejectedExecutionException e) {
                log.error("[TWS:{}] Could not schedule reconnect", getSessionLabel(), e);
                reconnectTask = null;
                state = ConnectionState.DISCONNECTED;
            }
        }
    }

    // caller holds lifecycleLock
    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(true);
            reconnectTask = null;
        }
    }

    private boolean isLive(long loopEpoch) {
        synchronized (lifecycleLock) {
            return !closed && epoch == loopEpoch;
        }
    }

    private void reconnectLoop(long loopEpoch) {
        String label = getSessionLabel();
        ReconnectionPolicy policy = ReconnectionPolicy.from(config);

        while (isLive(loopEpoch) && !policy.isExhausted()) {
            Duration delay = policy.nextDelay();
            log.info("[TWS:{}] Reconnecting in {}ms (attempt {}/{})",
                label, delay.toMillis(), policy.failures() + 1, policy.maxAttempts());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[TWS:{}] Reconnect loop cancelled", label);
                return;
            }
            if (!isLive(loopEpoch)) {
                return;
            }

            Session session;
            try {
                session = openSession();
            } catch (TwsConnectException e) {
                policy.recordFailure();
                log.warn("[TWS:{}] Reconnect attempt {}/{} failed: {}",
                    label, policy.failures(), policy.maxAttempts(), e.getMessage());
                continue;
            }

            ConnectionInfo info = activate(session, loopEpoch);
            if (info == null) {
                return;
            }
            resubscribe(label, info.serverVersion());
            if (metrics != null) {
                metrics.recordConnectionEvent(label, "RECONNECTED");
            }
            notifyListeners(l -> l.onReconnected(info));
            return;
        }

        synchronized (lifecycleLock) {
            if (closed || epoch != loopEpoch || state != ConnectionState.RECONNECTING) {
                return;
            }
            state = ConnectionState.DISCONNECTED;
            reconnectTask = null;
        }
        int attempts = policy.failures();
        log.error("[TWS:{}] Giving up after {} reconnect attempts", label, attempts);
        if (metrics != null) {
            metrics.recordConnectionEvent(label, "RECONNECT_FAILED");
        }
        notifyListeners(l -> l.onReconnectFailed(attempts));
    }

    private void resubscribe(String label, int serverVersion) {
        List<ClientRequest> requests = resubscriptionSource.activeRequests();
        int sent = 0;
        for (ClientRequest request : requests) {
            try {
                send(encoder.encode(request, serverVersion));
                sent++;
            } catch (EncodingException e) {
                log.error("[TWS:{}] Cannot re-encode subscription {}: {}", label, request.requestId(), e.getMessage());
            } catch (ConnectionLostException e) {
                log.warn("[TWS:{}] Session dropped during resubscription after {} of {}",
                    label, sent, requests.size());
                return;
            }
        }
        if (metrics != null) {
            metrics.recordResubscriptions(sent);
        }
        log.info("[TWS:{}] Re-sent {} subscription(s)", label, sent);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private void closeSession(Session session) {
        session.closed = true;
        if (session.heartbeat != null) {
            session.heartbeat.stop();
        }
        closeQuietly(session.socket);
    }

    private void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("[TWS:{}] Error closing socket: {}", getSessionLabel(), e.getMessage());
        }
    }

    private void notifyListeners(Consumer<ConnectionListener> action) {
        for (ConnectionListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("[TWS:{}] Connection listener threw exception", getSessionLabel(), e);
            }
        }
    }

    /**
     * One socket from handshake to close. Never reused.
     */
    private static final class Session {
        final Socket socket;
        final InputStream in;
        final OutputStream out;
        final WireDecoder decoder;
        final ConnectionInfo info;
        final List<InboundEvent> early;

        volatile boolean closed;
        volatile HeartbeatManager heartbeat;
        int protocolErrors;

        Session(Socket socket, InputStream in, OutputStream out, WireDecoder decoder,
                ConnectionInfo info, List<InboundEvent> early) {
            this.socket = socket;
            this.in = in;
            this.out = out;
            this.decoder = decoder;
            this.info = info;
            this.early = early;
        }
    }
}

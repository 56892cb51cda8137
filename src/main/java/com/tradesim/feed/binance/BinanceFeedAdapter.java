package com.tradesim.feed.binance;

import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.SubscriptionKey;
import com.tradesim.exception.FeedConnectionException;
import com.tradesim.feed.EventSequencer;
import com.tradesim.feed.FeedAdapter;
import com.tradesim.feed.MarketEventSink;
import com.tradesim.feed.ReconnectBackoff;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

/**
 * Streams one Binance raw stream (one symbol, one kind) over an OkHttp WebSocket.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #connect(MarketEventSink)} opens the socket and sends a SUBSCRIBE frame for the
 *       stream once it is open.</li>
 *   <li>On failure or a server-side close the socket is reopened after a
 *       {@link ReconnectBackoff} delay on the feed scheduler, and the stream is subscribed again.
 *       The attempt counter resets once a socket opens.</li>
 *   <li>{@link #close()} cancels any pending reconnect and closes the socket with 1000.</li>
 * </ul>
 *
 * <p>All messages pass through an {@link EventSequencer} before reaching the sink, so trades
 * Binance replays right after a reconnect are not delivered twice.
 */
public class BinanceFeedAdapter implements FeedAdapter {

    private static final Logger log = LoggerFactory.getLogger(BinanceFeedAdapter.class);

    private static final int NORMAL_CLOSURE = 1000;

    private final SubscriptionKey key;
    private final String endpoint;
    private final String streamName;
    private final OkHttpClient httpClient;
    private final BinanceMessageParser parser;
    private final ReconnectBackoff backoff;
    private final TaskScheduler scheduler;

    private final EventSequencer sequencer = new EventSequencer();
    private final AtomicInteger reconnectAttempts = new AtomicInteger(0);
    private final AtomicLong reconnects = new AtomicLong(0);
    private final AtomicInteger requestId = new AtomicInteger(1);

    private volatile MarketEventSink sink;
    private volatile WebSocket webSocket;
    private volatile ScheduledFuture<?> pendingReconnect;
    private volatile boolean connected;
    private volatile boolean everConnected;
    private volatile boolean closed;

    public BinanceFeedAdapter(
            SubscriptionKey key,
            String endpoint,
            String streamName,
            OkHttpClient httpClient,
            BinanceMessageParser parser,
            ReconnectBackoff backoff,
            TaskScheduler scheduler) {
        this.key = key;
        this.endpoint = endpoint;
        this.streamName = streamName;
        this.httpClient = httpClient;
        this.parser = parser;
        this.backoff = backoff;
        this.scheduler = scheduler;
    }

    @Override
    public SubscriptionKey key() {
        return key;
    }

    @Override
    public void connect(MarketEventSink sink) {
        if (closed) {
            throw new FeedConnectionException("Adapter for " + key + " is closed");
        }
        if (this.sink != null) {
            log.warn("Adapter for {} already connected, ignoring connect request", key);
            return;
        }
        this.sink = sink;
        log.info("Connecting Binance stream {} via {}", streamName, endpoint);
        try {
            openSocket();
        } catch (IllegalArgumentException e) {
            closed = true;
            throw new FeedConnectionException("Invalid Binance endpoint " + endpoint, e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;
        ScheduledFuture<?> reconnect = pendingReconnect;
        if (reconnect != null) {
            reconnect.cancel(false);
        }
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "unsubscribed");
        }
        log.info("Binance stream {} closed ({} reconnects, {} stale events dropped)",
                streamName, reconnects.get(), sequencer.rejectedCount());
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public long reconnectCount() {
        return reconnects.get();
    }

    String streamName() {
        return streamName;
    }

    String subscribeFrame() {
        return "{\"method\":\"SUBSCRIBE\",\"params\":[\"" + streamName + "\"],\"id\":"
                + requestId.getAndIncrement() + "}";
    }

    void handleMessage(String text) {
        MarketEventSink target = sink;
        if (closed || target == null) {
            return;
        }
        parser.parse(text, key.getKind())
                .filter(this::acceptInOrder)
                .ifPresent(target::onEvent);
    }

    private synchronized boolean acceptInOrder(MarketEvent event) {
        return sequencer.accept(event);
    }

    private void openSocket() {
        Request request = new Request.Builder().url(endpoint).build();
        webSocket = httpClient.newWebSocket(request, new StreamListener());
    }

    private void onOpened(WebSocket socket) {
        if (closed) {
            socket.close(NORMAL_CLOSURE, "closed");
            return;
        }
        connected = true;
        reconnectAttempts.set(0);
        socket.send(subscribeFrame());
        if (everConnected) {
            reconnects.incrementAndGet();
            log.info("Binance stream {} reconnected, resubscribed", streamName);
        } else {
            everConnected = true;
            log.info("Binance stream {} connected", streamName);
        }
    }

    private void onDropped(WebSocket socket, String reason) {
        if (socket != webSocket) {
            return;
        }
        connected = false;
        if (closed) {
            return;
        }
        int attempt = reconnectAttempts.getAndIncrement();
        Duration delay = backoff.nextDelay(attempt);
        log.warn("Binance stream {} dropped ({}), reconnect attempt {} in {}ms",
                streamName, reason, attempt + 1, delay.toMillis());
        pendingReconnect = scheduler.schedule(this::reconnect, Instant.now().plus(delay));
    }

    private void reconnect() {
        if (closed) {
            return;
        }
        try {
            openSocket();
        } catch (RuntimeException e) {
            log.error("Binance stream {} reconnect failed: {}", streamName, e.getMessage());
            onDropped(webSocket, e.getMessage());
        }
    }

    private class StreamListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket socket, Response response) {
            onOpened(socket);
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            handleMessage(text);
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            onDropped(socket, "closed by server: " + code + " " + reason);
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            onDropped(socket, t.getClass().getSimpleName() + ": " + t.getMessage());
        }
    }
}

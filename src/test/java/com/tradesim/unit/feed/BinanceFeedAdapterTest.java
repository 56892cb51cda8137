package com.tradesim.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.SubscriptionKey;
import com.tradesim.feed.ReconnectBackoff;
import com.tradesim.feed.binance.BinanceFeedAdapter;
import com.tradesim.feed.binance.BinanceMessageParser;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for {@link BinanceFeedAdapter}: resubscribe after a dropped socket, replay
 * suppression and cancellation of a pending reconnect on close. The OkHttp transport and the
 * scheduler are mocked; socket callbacks are driven through the captured listener.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BinanceFeedAdapterTest {

    private static final String ENDPOINT = "wss://stream.binance.com:9443/ws";

    @Mock
    private OkHttpClient httpClient;

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private WebSocket firstSocket;

    @Mock
    private WebSocket secondSocket;

    @Mock
    private ScheduledFuture<?> pendingReconnect;

    private final List<MarketEvent> delivered = new ArrayList<>();
    private BinanceFeedAdapter adapter;

    @BeforeEach
    void setUp() {
        when(httpClient.newWebSocket(any(Request.class), any(WebSocketListener.class)))
                .thenReturn(firstSocket)
                .thenReturn(secondSocket);
        doReturn(pendingReconnect).when(scheduler).schedule(any(Runnable.class), any(Instant.class));

        adapter = new BinanceFeedAdapter(
                new SubscriptionKey("BTCUSDT", EventKind.TRADE),
                ENDPOINT,
                "btcusdt@trade",
                httpClient,
                new BinanceMessageParser(new ObjectMapper()),
                new ReconnectBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), () -> 0.5),
                scheduler);
    }

    private static String trade(long tradeId, long tradeTimeMs) {
        return "{\"e\":\"trade\",\"E\":" + tradeTimeMs + ",\"s\":\"BTCUSDT\",\"t\":" + tradeId
                + ",\"p\":\"43250.10\",\"q\":\"0.015\",\"T\":" + tradeTimeMs + ",\"m\":false}";
    }

    private List<WebSocketListener> listeners(int expectedSockets) {
        ArgumentCaptor<WebSocketListener> captor = ArgumentCaptor.forClass(WebSocketListener.class);
        verify(httpClient, times(expectedSockets)).newWebSocket(any(Request.class), captor.capture());
        return captor.getAllValues();
    }

    private Runnable scheduledReconnect() {
        ArgumentCaptor<Runnable> captor = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(captor.capture(), any(Instant.class));
        return captor.getValue();
    }

    @Test
    @DisplayName("Open socket sends a SUBSCRIBE frame for the stream")
    void subscribesOnOpen() {
        adapter.connect(delivered::add);
        listeners(1).get(0).onOpen(firstSocket, null);

        verify(firstSocket).send(contains("\"method\":\"SUBSCRIBE\",\"params\":[\"btcusdt@trade\"]"));
        assertThat(adapter.isConnected()).isTrue();
        assertThat(adapter.reconnectCount()).isZero();
    }

    @Test
    @DisplayName("Socket failure schedules a reconnect instead of reconnecting inline")
    void failureSchedulesReconnect() {
        adapter.connect(delivered::add);
        WebSocketListener listener = listeners(1).get(0);
        listener.onOpen(firstSocket, null);

        listener.onFailure(firstSocket, new IOException("connection reset"), null);

        assertThat(adapter.isConnected()).isFalse();
        scheduledReconnect();
        verify(httpClient, times(1)).newWebSocket(any(Request.class), any(WebSocketListener.class));
    }

    @Test
    @DisplayName("Reconnect opens a new socket, resubscribes and counts the reconnect")
    void reconnectResubscribes() {
        adapter.connect(delivered::add);
        WebSocketListener first = listeners(1).get(0);
        first.onOpen(firstSocket, null);
        first.onFailure(firstSocket, new IOException("connection reset"), null);

        scheduledReconnect().run();
        WebSocketListener second = listeners(2).get(1);
        second.onOpen(secondSocket, null);

        verify(secondSocket).send(contains("\"method\":\"SUBSCRIBE\",\"params\":[\"btcusdt@trade\"]"));
        assertThat(adapter.reconnectCount()).isEqualTo(1);
        assertThat(adapter.isConnected()).isTrue();
    }

    @Test
    @DisplayName("Trades replayed after a reconnect never reach the sink twice")
    void replayedTradesSuppressed() {
        adapter.connect(delivered::add);
        WebSocketListener first = listeners(1).get(0);
        first.onOpen(firstSocket, null);
        first.onMessage(firstSocket, trade(10, 1_700_000_000_000L));
        first.onMessage(firstSocket, trade(11, 1_700_000_000_100L));
        first.onFailure(firstSocket, new IOException("connection reset"), null);

        scheduledReconnect().run();
        WebSocketListener second = listeners(2).get(1);
        second.onOpen(secondSocket, null);
        second.onMessage(secondSocket, trade(10, 1_700_000_000_000L));
        second.onMessage(secondSocket, trade(11, 1_700_000_000_100L));
        second.onMessage(secondSocket, trade(12, 1_700_000_000_200L));

        assertThat(delivered).extracting(MarketEvent::getSequence).containsExactly(10L, 11L, 12L);
    }

    @Test
    @DisplayName("Close cancels the pending reconnect and a late run opens nothing")
    void closeCancelsPendingReconnect() {
        adapter.connect(delivered::add);
        WebSocketListener first = listeners(1).get(0);
        first.onOpen(firstSocket, null);
        first.onFailure(firstSocket, new IOException("connection reset"), null);
        Runnable reconnect = scheduledReconnect();

        adapter.close();
        reconnect.run();

        verify(pendingReconnect).cancel(false);
        verify(firstSocket).close(eq(1000), anyString());
        verify(httpClient, times(1)).newWebSocket(any(Request.class), any(WebSocketListener.class));
        assertThat(adapter.isConnected()).isFalse();
    }

    @Test
    @DisplayName("Callbacks from a superseded socket are ignored")
    void staleSocketIgnored() {
        adapter.connect(delivered::add);
        WebSocketListener first = listeners(1).get(0);
        first.onOpen(firstSocket, null);
        first.onFailure(firstSocket, new IOException("connection reset"), null);
        scheduledReconnect().run();
        listeners(2).get(1).onOpen(secondSocket, null);

        first.onClosed(firstSocket, 1006, "abnormal");

        verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
        verify(secondSocket, never()).close(eq(1000), anyString());
        assertThat(adapter.isConnected()).isTrue();
    }
}

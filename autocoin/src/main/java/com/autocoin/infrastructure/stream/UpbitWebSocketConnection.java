package com.autocoin.infrastructure.stream;

import com.autocoin.domain.model.Tick;
import com.autocoin.infrastructure.common.HeartbeatManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Upbit WebSocket session.
 *
 * Frames are handed from the WebSocket listener to the calling thread through a queue;
 * the next frame is only requested once the previous one has been decoded and
 * published, so a slow pipeline slows the socket instead of buffering without bound.
 * Pings from the server are answered by the HTTP client. Our own keepalive pings are
 * sent by a {@link HeartbeatManager}, which ends the session after a silent period.
 */
public class UpbitWebSocketConnection implements MarketDataConnection {
    private static final Logger log = LoggerFactory.getLogger(UpbitWebSocketConnection.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration PING_INTERVAL = Duration.ofSeconds(30);
    private static final Duration ACTIVITY_TIMEOUT = Duration.ofSeconds(60);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String wsUrl;
    private final String streamType;
    private final TickDecoder decoder;
    private final Duration pingInterval;
    private final Duration activityTimeout;
    private final HttpClient httpClient;

    public UpbitWebSocketConnection(String wsUrl, String streamType, TickDecoder decoder) {
        this(wsUrl, streamType, decoder, PING_INTERVAL, ACTIVITY_TIMEOUT);
    }

    public UpbitWebSocketConnection(String wsUrl, String streamType, TickDecoder decoder,
                                    Duration pingInterval, Duration activityTimeout) {
        this.wsUrl = wsUrl;
        this.streamType = streamType;
        this.decoder = decoder;
        this.pingInterval = pingInterval;
        this.activityTimeout = activityTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
    }

    @Override
    public void streamUntilClosed(List<String> markets, Listener listener) throws InterruptedException {
        BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
        FrameListener frameListener = new FrameListener(frames);

        log.info("[STREAM] Connecting to {}", wsUrl);
        WebSocket ws = connect(frameListener);

        HeartbeatManager heartbeat = new HeartbeatManager(
            "upbit-stream",
            pingInterval,
            activityTimeout,
            () -> ws.sendPing(ByteBuffer.allocate(0)),
            () -> frames.offer(Frame.timeout()));
        frameListener.heartbeat = heartbeat;

        try {
            String subscription = subscriptionMessage(UUID.randomUUID().toString(), streamType, markets);
            log.info("[STREAM] Subscribing to {} {} markets", markets.size(), streamType);
            awaitSend(ws.sendText(subscription, true));

            heartbeat.start();
            listener.onConnected();

            while (true) {
                Frame frame = frames.take();
                switch (frame.kind) {
                    case TEXT -> publish(decoder.decodeText(frame.text), listener);
                    case BINARY -> publish(decoder.decodeBinary(frame.bytes), listener);
                    case CLOSED -> throw new StreamException("Connection closed by peer: " + frame.text);
                    case ERROR -> throw new StreamException("Connection error: " + frame.error.getMessage(), frame.error);
                    case TIMEOUT -> throw new StreamException("No activity for " + activityTimeout.toSeconds() + "s");
                }
                ws.request(1);
            }
        } finally {
            heartbeat.stop();
            if (!ws.isOutputClosed() || !ws.isInputClosed()) {
                ws.abort();
            }
        }
    }

    /**
     * Subscription request sent once per connection.
     */
    public static String subscriptionMessage(String ticket, String type, List<String> codes) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("ticket", ticket);
        message.put("type", type);
        ArrayNode codesNode = message.putArray("codes");
        codes.forEach(codesNode::add);
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode subscription", e);
        }
    }

    private WebSocket connect(WebSocket.Listener listener) throws InterruptedException {
        try {
            return httpClient.newWebSocketBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .buildAsync(URI.create(wsUrl), listener)
                .get(CONNECT_TIMEOUT.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StreamException("Connection failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new StreamException("Connection timed out", e);
        }
    }

    private static void awaitSend(CompletableFuture<WebSocket> send) throws InterruptedException {
        try {
            send.get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StreamException("Failed to send subscription: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new StreamException("Timed out sending subscription", e);
        }
    }

    private static void publish(List<Tick> ticks, Listener listener) throws InterruptedException {
        for (Tick tick : ticks) {
            listener.onTick(tick);
        }
    }

    private enum FrameKind { TEXT, BINARY, CLOSED, ERROR, TIMEOUT }

    private static final class Frame {
        final FrameKind kind;
        final String text;
        final byte[] bytes;
        final Throwable error;

        private Frame(FrameKind kind, String text, byte[] bytes, Throwable error) {
            this.kind = kind;
            this.text = text;
            this.bytes = bytes;
            this.error = error;
        }

        static Frame text(String text) {
            return new Frame(FrameKind.TEXT, text, null, null);
        }

        static Frame binary(byte[] bytes) {
            return new Frame(FrameKind.BINARY, null, bytes, null);
        }

        static Frame closed(int statusCode, String reason) {
            return new Frame(FrameKind.CLOSED, statusCode + " " + reason, null, null);
        }

        static Frame error(Throwable error) {
            return new Frame(FrameKind.ERROR, null, null, error);
        }

        static Frame timeout() {
            return new Frame(FrameKind.TIMEOUT, null, null, null);
        }
    }

    /**
     * Reassembles partial messages and queues complete ones. Requests the next partial
     * immediately; the next complete message is requested by the consuming thread.
     */
    private static final class FrameListener implements WebSocket.Listener {
        private final BlockingQueue<Frame> frames;
        private final StringBuilder textBuf = new StringBuilder();
        private final ByteArrayOutputStream binaryBuf = new ByteArrayOutputStream();
        volatile HeartbeatManager heartbeat;

        FrameListener(BlockingQueue<Frame> frames) {
            this.frames = frames;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("[STREAM] ✅ Connected");
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            recordActivity();
            textBuf.append(data);
            if (last) {
                frames.offer(Frame.text(textBuf.toString()));
                textBuf.setLength(0);
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            recordActivity();
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binaryBuf.write(chunk, 0, chunk.length);
            if (last) {
                frames.offer(Frame.binary(binaryBuf.toByteArray()));
                binaryBuf.reset();
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            recordActivity();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            recordActivity();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("[STREAM] Closed by peer: {} {}", statusCode, reason);
            frames.offer(Frame.closed(statusCode, reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("[STREAM] WebSocket error: {}", error.toString());
            frames.offer(Frame.error(error));
        }

        private void recordActivity() {
            HeartbeatManager hb = heartbeat;
            if (hb != null) {
                hb.recordActivity();
            }
        }
    }
}

package com.surrealsimple.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DatabaseSession} over SurrealDB's WebSocket RPC endpoint.
 *
 * One connection carries every request; replies are matched to requests by id,
 * so several threads may query concurrently. The connection keeps server-side
 * session state (namespace, database, open transaction) between calls.
 */
public class WebSocketSession implements DatabaseSession, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketSession.class);

    private final DatabaseSettings settings;
    private final RpcCodec codec;
    private final HttpClient httpClient;
    private final AtomicLong requestIds = new AtomicLong();
    private final Map<String, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();

    private volatile WebSocket webSocket;

    public WebSocketSession(DatabaseSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.codec = new RpcCodec(objectMapper != null ? objectMapper : new ObjectMapper());
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(settings.getConnectTimeout())
            .build();
    }

    /**
     * Open the connection, sign in with the configured root credentials and
     * select the namespace and database.
     */
    public void connect() throws SessionException {
        URI uri = settings.rpcUri();
        if (isOpen()) {
            throw new SessionException("Session is already connected to " + uri);
        }
        logger.info("Connecting to SurrealDB at {}", uri);
        try {
            webSocket = httpClient.newWebSocketBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .buildAsync(uri, new FrameListener())
                .get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            throw new SessionException("Failed to open WebSocket to " + uri, e.getCause());
        } catch (TimeoutException e) {
            throw new SessionException("Timed out opening WebSocket to " + uri, e);
        }

        try {
            call("signin", List.of(Map.of("user", settings.getUsername(), "pass", settings.getPassword())));
            call("use", List.of(settings.getNamespace(), settings.getDatabase()));
        } catch (SessionException e) {
            close();
            throw e;
        }

        logger.info("✅ SurrealDB session ready: ns={}, db={}", settings.getNamespace(), settings.getDatabase());
    }

    /**
     * Bind an already-open socket whose incoming frames are delivered to the
     * returned listener.
     */
    WebSocket.Listener attach(WebSocket ws) {
        this.webSocket = ws;
        return new FrameListener();
    }

    @Override
    public QueryResponse query(String script, Map<String, Object> variables) throws SessionException {
        JsonNode reply = call("query", List.of(script, variables != null ? variables : Map.of()));
        try {
            return QueryResponse.fromJson(reply);
        } catch (IllegalArgumentException e) {
            throw new SessionException("Unexpected query reply: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = webSocket;
        return ws != null && !ws.isOutputClosed() && !ws.isInputClosed();
    }

    JsonNode call(String method, List<?> params) throws SessionException {
        WebSocket ws = webSocket;
        if (ws == null || ws.isOutputClosed()) {
            throw new SessionException("Session is not connected");
        }

        String id = Long.toString(requestIds.incrementAndGet());
        String frame;
        try {
            frame = codec.encode(id, method, params);
        } catch (JsonProcessingException e) {
            throw new SessionException("Failed to encode " + method + " request", e);
        }

        long timeoutMs = settings.getRequestTimeout().toMillis();
        CompletableFuture<JsonNode> reply = new CompletableFuture<>();
        pending.put(id, reply);
        try {
            send(ws, method, frame, timeoutMs);
            return reply.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionOutcomeUnknownException("Interrupted while awaiting reply to " + method, e);
        } catch (TimeoutException e) {
            throw new SessionOutcomeUnknownException("No reply to " + method + " within " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SessionException) {
                throw (SessionException) cause;
            }
            throw new SessionException(method + " failed", cause);
        } finally {
            pending.remove(id);
        }
    }

    // The JDK WebSocket allows a single outstanding send.
    private void send(WebSocket ws, String method, String frame, long timeoutMs)
            throws SessionException, InterruptedException, TimeoutException {
        synchronized (sendLock) {
            try {
                ws.sendText(frame, true).get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new SessionException("Failed to send " + method + " request", e.getCause());
            }
        }
        logger.trace("Sent {} request", method);
    }

    private void dispatch(String frame) {
        RpcCodec.RpcReply reply;
        try {
            reply = codec.decode(frame);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable RPC frame: {}", e.getOriginalMessage());
            return;
        }
        if (reply.getId() == null) {
            logger.debug("Ignoring RPC notification without id");
            return;
        }
        CompletableFuture<JsonNode> waiting = pending.get(reply.getId());
        if (waiting == null) {
            logger.debug("No caller waiting for RPC reply id={}", reply.getId());
            return;
        }
        if (reply.isError()) {
            waiting.completeExceptionally(new SessionException(
                String.format("RPC error %d: %s", reply.getErrorCode(), reply.getErrorMessage())));
        } else {
            waiting.complete(reply.getResult());
        }
    }

    private void failPending(SessionException failure) {
        List<CompletableFuture<JsonNode>> waiting = new ArrayList<>(pending.values());
        for (CompletableFuture<JsonNode> future : waiting) {
            future.completeExceptionally(failure);
        }
    }

    @Override
    public void close() {
        WebSocket ws = webSocket;
        if (ws == null) {
            return;
        }
        webSocket = null;
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "closing")
                .get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ws.abort();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("WebSocket did not close cleanly, aborting", e);
            ws.abort();
        }
        failPending(new SessionOutcomeUnknownException("Session closed with requests in flight", null));
        logger.info("SurrealDB session closed");
    }

    private final class FrameListener implements WebSocket.Listener {
        private final StringBuilder buffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket ws) {
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String frame = buffer.toString();
                buffer.setLength(0);
                dispatch(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            logger.info("SurrealDB closed the connection: {} {}", statusCode, reason);
            failPending(new SessionOutcomeUnknownException(
                "Connection closed (" + statusCode + ") with requests in flight", null));
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            logger.error("SurrealDB connection failed", error);
            failPending(new SessionOutcomeUnknownException("Connection failed with requests in flight", error));
        }
    }
}

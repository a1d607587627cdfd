package com.surrealsimple.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * In-process {@link WebSocket} that records every sent frame and answers it
 * through the session's listener on the sending thread. A responder returning
 * null leaves the request unanswered.
 */
public class StubWebSocket implements WebSocket {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<JsonNode> sent = new CopyOnWriteArrayList<>();
    private final CountDownLatch firstSend = new CountDownLatch(1);
    private final Function<JsonNode, List<String>> responder;

    private WebSocket.Listener listener;
    private volatile boolean closed;
    private IOException sendFailure;

    public StubWebSocket(Function<JsonNode, List<String>> responder) {
        this.responder = responder;
    }

    void setListener(WebSocket.Listener listener) {
        this.listener = listener;
    }

    void failSendsWith(IOException failure) {
        this.sendFailure = failure;
    }

    List<JsonNode> getSent() {
        return sent;
    }

    CountDownLatch firstSend() {
        return firstSend;
    }

    @Override
    public CompletableFuture<WebSocket> sendText(CharSequence data, boolean last) {
        if (sendFailure != null) {
            return CompletableFuture.failedFuture(sendFailure);
        }
        JsonNode request;
        try {
            request = mapper.readTree(data.toString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        sent.add(request);
        firstSend.countDown();
        List<String> replies = responder.apply(request);
        if (replies != null) {
            for (String reply : replies) {
                listener.onText(this, reply, true);
            }
        }
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public CompletableFuture<WebSocket> sendBinary(ByteBuffer data, boolean last) {
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public CompletableFuture<WebSocket> sendPing(ByteBuffer message) {
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public CompletableFuture<WebSocket> sendPong(ByteBuffer message) {
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public CompletableFuture<WebSocket> sendClose(int statusCode, String reason) {
        closed = true;
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public void request(long n) {
    }

    @Override
    public String getSubprotocol() {
        return "";
    }

    @Override
    public boolean isOutputClosed() {
        return closed;
    }

    @Override
    public boolean isInputClosed() {
        return closed;
    }

    @Override
    public void abort() {
        closed = true;
    }

    /** Delivers a close frame from the server side. */
    CompletionStage<?> serverClose(int statusCode, String reason) {
        closed = true;
        return listener.onClose(this, statusCode, reason);
    }
}

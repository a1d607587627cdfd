package com.surrealsimple.core.session;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for a SurrealDB endpoint.
 */
@Getter
@Builder
@ToString(exclude = "password")
public class DatabaseSettings {

    @Builder.Default
    private final String host = "localhost";

    @Builder.Default
    private final int port = 8000;

    @Builder.Default
    private final String username = "surreal";

    @Builder.Default
    private final String password = "password";

    @Builder.Default
    private final String namespace = "namespace";

    @Builder.Default
    private final String database = "database";

    @Builder.Default
    private final boolean sslMode = false;

    @Builder.Default
    private final Duration requestTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration connectTimeout = Duration.ofSeconds(10);

    public static DatabaseSettings defaults() {
        return builder().build();
    }

    /**
     * RPC endpoint, {@code ws://host:port/rpc} or {@code wss://...} when SSL is on.
     */
    public URI rpcUri() {
        return URI.create(String.format("%s://%s:%d/rpc", sslMode ? "wss" : "ws", host, port));
    }
}

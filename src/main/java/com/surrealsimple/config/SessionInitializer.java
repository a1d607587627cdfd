package com.surrealsimple.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surrealsimple.core.session.DatabaseSession;
import com.surrealsimple.core.session.DatabaseSettings;
import com.surrealsimple.core.session.SessionException;
import com.surrealsimple.core.session.WebSocketSession;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Opens the application's SurrealDB session at startup and closes it at shutdown.
 *
 * A failed connect is logged and leaves the session closed; the health check
 * then reports 503 and queries fail instead of the application refusing to start.
 */
@Startup
@ApplicationScoped
public class SessionInitializer {
    private static final Logger logger = LoggerFactory.getLogger(SessionInitializer.class);

    @ConfigProperty(name = "surreal.host", defaultValue = "localhost")
    String host;

    @ConfigProperty(name = "surreal.port", defaultValue = "8000")
    int port;

    @ConfigProperty(name = "surreal.username", defaultValue = "surreal")
    String username;

    @ConfigProperty(name = "surreal.password", defaultValue = "password")
    String password;

    @ConfigProperty(name = "surreal.namespace", defaultValue = "namespace")
    String namespace;

    @ConfigProperty(name = "surreal.database", defaultValue = "database")
    String database;

    @ConfigProperty(name = "surreal.ssl", defaultValue = "false")
    boolean ssl;

    @ConfigProperty(name = "surreal.request-timeout-ms", defaultValue = "30000")
    long requestTimeoutMs;

    @ConfigProperty(name = "surreal.connect-timeout-ms", defaultValue = "10000")
    long connectTimeoutMs;

    @Inject
    ObjectMapper objectMapper;

    private WebSocketSession session;

    @PostConstruct
    void init() {
        DatabaseSettings settings = settings();
        session = new WebSocketSession(settings, objectMapper);
        try {
            session.connect();
        } catch (SessionException e) {
            logger.error("❌ Could not open SurrealDB session with {}", settings, e);
        }
    }

    DatabaseSettings settings() {
        return DatabaseSettings.builder()
            .host(host)
            .port(port)
            .username(username)
            .password(password)
            .namespace(namespace)
            .database(database)
            .sslMode(ssl)
            .requestTimeout(Duration.ofMillis(requestTimeoutMs))
            .connectTimeout(Duration.ofMillis(connectTimeoutMs))
            .build();
    }

    @Produces
    @ApplicationScoped
    DatabaseSession produceSession() {
        return session;
    }

    @PreDestroy
    void close() {
        if (session != null) {
            session.close();
        }
    }
}

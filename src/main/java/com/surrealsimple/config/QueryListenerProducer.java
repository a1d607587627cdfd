package com.surrealsimple.config;

import com.surrealsimple.core.query.LoggingQueryListener;
import com.surrealsimple.core.query.QueryListener;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

@ApplicationScoped
public class QueryListenerProducer {

    @Produces
    @ApplicationScoped
    QueryListener queryListener() {
        return new LoggingQueryListener();
    }
}

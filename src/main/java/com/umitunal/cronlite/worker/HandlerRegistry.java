package com.umitunal.cronlite.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps payload kinds to handlers.
 * <p>
 * Registering a second handler for a kind keeps the first one and logs a warning, or
 * fails when the registry is strict.
 */
public class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final boolean strict;

    public HandlerRegistry() {
        this(false);
    }

    public HandlerRegistry(boolean strict) {
        this.strict = strict;
    }

    public void register(String kind, JobHandler handler) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Handler kind must not be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler must not be null");
        }

        JobHandler previous = handlers.putIfAbsent(kind, handler);
        if (previous == null) {
            log.info("Handler registered: {} -> {}", kind, handler.getClass().getName());
            return;
        }
        if (previous == handler) {
            return;
        }

        String msg = String.format("Duplicate handler for kind '%s' (existing=%s, new=%s)",
                kind, previous.getClass().getName(), handler.getClass().getName());
        if (strict) {
            throw new IllegalStateException(msg);
        }
        log.warn("{}; keeping existing handler", msg);
    }

    public Optional<JobHandler> find(String kind) {
        if (kind == null) return Optional.empty();
        return Optional.ofNullable(handlers.get(kind));
    }

    public boolean contains(String kind) {
        return kind != null && handlers.containsKey(kind);
    }

    public Set<String> kinds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(handlers.keySet()));
    }
}

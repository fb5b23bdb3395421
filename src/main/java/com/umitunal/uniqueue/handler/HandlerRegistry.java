package com.umitunal.uniqueue.handler;

import com.umitunal.uniqueue.core.UnknownTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps job types to their handlers. Thread-safe; handlers are normally registered at startup.
 */
public class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final ConcurrentMap<String, JobHandler> handlersByType = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the type already has a handler
     */
    public HandlerRegistry register(String type, JobHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (handlersByType.putIfAbsent(type, handler) != null) {
            throw new IllegalStateException("Duplicate JobHandler for type: " + type);
        }
        log.info("Registered handler for job type '{}'", type);
        return this;
    }

    /**
     * @return true if a handler was removed
     */
    public boolean unregister(String type) {
        boolean removed = handlersByType.remove(type) != null;
        if (removed) {
            log.info("Unregistered handler for job type '{}'", type);
        }
        return removed;
    }

    public JobHandler resolve(String type) throws UnknownTypeException {
        JobHandler handler = type == null ? null : handlersByType.get(type);
        if (handler == null) {
            throw new UnknownTypeException(type);
        }
        return handler;
    }

    public boolean isRegistered(String type) {
        return type != null && handlersByType.containsKey(type);
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlersByType.keySet()));
    }
}

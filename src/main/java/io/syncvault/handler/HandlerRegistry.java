package io.syncvault.handler;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class HandlerRegistry {
    private final Map<String, CollectionHandler> handlers = new ConcurrentHashMap<>();

    public void register(CollectionHandler handler) {
        if (handler.name() == null || handler.name().isBlank()) {
            throw new IllegalArgumentException("handler name must not be blank");
        }
        handlers.put(handler.name(), handler);
    }

    public Optional<CollectionHandler> findByName(String name) {
        return Optional.ofNullable(name == null ? null : handlers.get(name));
    }

    public CollectionHandler require(String name) {
        return findByName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown handler: " + name));
    }

    public boolean unregister(String name) {
        return handlers.remove(name) != null;
    }

    public Collection<String> listNames() {
        return new TreeSet<>(handlers.keySet());
    }
}

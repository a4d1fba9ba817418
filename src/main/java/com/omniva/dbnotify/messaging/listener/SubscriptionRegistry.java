package com.omniva.dbnotify.messaging.listener;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps subscription keys to sets of handler references.
 * <p>
 * Handlers are compared by reference: registering the same instance twice
 * under one key is a no-op. Entries are created on first subscribe and
 * removed when their last handler leaves.
 * <p>
 * NOT thread-safe. The owning listener guards every call with the same lock
 * that guards its connection state.
 */
public class SubscriptionRegistry {

    private final Map<SubscriptionKey, Set<ChangeHandler>> handlers = new HashMap<>();

    /**
     * @return true if the handler was added, false if it was already registered under the key
     */
    public boolean add(SubscriptionKey key, ChangeHandler handler) {
        return handlers
                .computeIfAbsent(key, k -> Collections.newSetFromMap(new IdentityHashMap<>()))
                .add(handler);
    }

    /**
     * @return true if the handler was registered under the key and has been removed
     */
    public boolean remove(SubscriptionKey key, ChangeHandler handler) {
        Set<ChangeHandler> set = handlers.get(key);
        if (set == null) {
            return false;
        }
        boolean removed = set.remove(handler);
        if (set.isEmpty()) {
            handlers.remove(key);
        }
        return removed;
    }

    /**
     * Snapshot of the handlers under a key, safe to iterate after the lock is released
     */
    public List<ChangeHandler> handlersFor(SubscriptionKey key) {
        Set<ChangeHandler> set = handlers.get(key);
        return set == null ? List.of() : List.copyOf(set);
    }

    public boolean contains(SubscriptionKey key) {
        return handlers.containsKey(key);
    }

    public Set<SubscriptionKey> keys() {
        return Set.copyOf(handlers.keySet());
    }

    public int getHandlerCount() {
        return handlers.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public void clear() {
        handlers.clear();
    }
}

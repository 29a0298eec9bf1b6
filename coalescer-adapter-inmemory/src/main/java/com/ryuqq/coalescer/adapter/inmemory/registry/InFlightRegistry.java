package com.ryuqq.coalescer.adapter.inmemory.registry;

import com.ryuqq.coalescer.core.model.RequestKey;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory registry of executing requests, at most one per {@link RequestKey}.
 *
 * <p>The registry is the deduplication core: a key that is present here has a live
 * execution, and late callers for the same key attach to that entry instead of running
 * the operation again.</p>
 *
 * <p><strong>Ownership:</strong></p>
 * <ul>
 *   <li>The registry exclusively owns every registered {@link PendingRequest}</li>
 *   <li>Entries leave on completion, timeout, cancellation or clear</li>
 *   <li>Removal by completion is identity-checked so that a stale completion never evicts
 *       a newer entry registered under the same key</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Not thread-safe on its own</li>
 *   <li>The owning engine serializes every call under its engine-wide monitor, which also
 *       guards the open batch windows, so that check-then-register is atomic across both</li>
 * </ul>
 *
 * @author Coalescer Team
 * @since 1.0.0
 */
public class InFlightRegistry {

    /**
     * RequestKey → PendingRequest mapping, in registration order.
     */
    private final Map<RequestKey, PendingRequest<?>> entries;

    /**
     * Creates a new empty registry.
     */
    public InFlightRegistry() {
        this.entries = new LinkedHashMap<>();
    }

    /**
     * Finds the live entry for a key.
     *
     * @param key the request key
     * @return the entry, or null if none is registered
     * @throws IllegalArgumentException if key is null
     */
    public PendingRequest<?> find(RequestKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return entries.get(key);
    }

    /**
     * Registers a new entry.
     *
     * @param request the request to register
     * @throws IllegalArgumentException if request is null
     * @throws IllegalStateException if another entry is already registered under the same key
     */
    public void register(PendingRequest<?> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        PendingRequest<?> existing = entries.putIfAbsent(request.getKey(), request);
        if (existing != null && existing != request) {
            throw new IllegalStateException("Key already in flight: " + request.getKey().getValue());
        }
    }

    /**
     * Removes an entry only if it is still the one registered under its key.
     *
     * @param request the request to remove
     * @return true if the entry was removed
     */
    public boolean remove(PendingRequest<?> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return entries.remove(request.getKey(), request);
    }

    /**
     * Removes whatever entry is registered under a key.
     *
     * @param key the request key
     * @return the removed entry, or null if none
     */
    public PendingRequest<?> remove(RequestKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return entries.remove(key);
    }

    /**
     * Removes and returns every entry older than the given age.
     *
     * @param now current time in epoch millis
     * @param maxAgeMs maximum allowed age in milliseconds
     * @return the expired entries in registration order
     */
    public List<PendingRequest<?>> removeExpired(long now, long maxAgeMs) {
        List<PendingRequest<?>> expired = new ArrayList<>();
        Iterator<PendingRequest<?>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            PendingRequest<?> request = iterator.next();
            if (request.ageMs(now) > maxAgeMs) {
                expired.add(request);
                iterator.remove();
            }
        }
        return expired;
    }

    /**
     * Removes and returns every entry.
     *
     * @return all entries in registration order
     */
    public List<PendingRequest<?>> removeAll() {
        List<PendingRequest<?>> all = new ArrayList<>(entries.values());
        entries.clear();
        return all;
    }

    /**
     * Returns a copy of the current entries.
     *
     * @return entries in registration order
     */
    public List<PendingRequest<?>> snapshot() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }
}

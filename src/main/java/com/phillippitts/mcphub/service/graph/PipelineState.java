package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.exception.MissingStateKeyException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable key/value state threaded through one graph execution.
 *
 * <p>Keys are namespaced strings such as {@code meeting.transcript}. A state instance belongs
 * to exactly one execution and is only touched by the worker running it, so it is not
 * synchronized.
 */
public final class PipelineState {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public PipelineState() {
    }

    public PipelineState(Map<String, ?> initial) {
        merge(initial);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Returns a value that must be present.
     *
     * @throws MissingStateKeyException if the key was never written
     * @throws ClassCastException       if the value has a different type
     */
    public <T> T require(String key, Class<T> type) {
        if (!values.containsKey(key)) {
            throw new MissingStateKeyException(key);
        }
        return type.cast(values.get(key));
    }

    public String requireString(String key) {
        Object v = require(key, Object.class);
        return v == null ? null : v.toString();
    }

    /**
     * Merges a partial update; later writes replace earlier values for the same key.
     */
    public void merge(Map<String, ?> update) {
        if (update == null) {
            return;
        }
        update.forEach((k, v) -> values.put(Objects.requireNonNull(k, "state key"), v));
    }

    /** Read-only copy in insertion order. */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "PipelineState" + values.keySet();
    }
}

package com.geofeature.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Shared attribute dictionary mapping attribute names to slot indices.
 * Many features hold a reference to the same schema, so attribute names are
 * stored once while each feature keeps only a dense value list.
 *
 * <p>Entries iterate in name order, not registration order.
 *
 * <p>Lookups on a schema that is no longer growing are safe from any thread.
 * Growth ({@link #registerSlot}, {@link #registerExisting}, or
 * {@link Feature#putNew} on any feature sharing this schema) is not
 * synchronized: callers sharing a schema across threads must use a single
 * writer or lock externally.
 */
public class FeatureSchema {

    private final TreeMap<String, Integer> mapping = new TreeMap<>();

    /**
     * Create a schema with the given names registered in argument order
     */
    public static FeatureSchema of(String... names) {
        FeatureSchema schema = new FeatureSchema();
        for (String name : names) {
            schema.registerSlot(name);
        }
        return schema;
    }

    /**
     * Register a name at the next free slot.
     *
     * <p>The returned index is computed before the uniqueness check: if the
     * name is already registered the mapping is left untouched and the
     * returned value is the index the name would have received, not its
     * stored index.
     */
    public int registerSlot(String name) {
        int index = mapping.size();
        insert(name, index);
        return index;
    }

    /**
     * Register a name at an externally assigned index. An existing mapping is
     * never overwritten.
     */
    public int registerExisting(String name, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Slot index must not be negative: " + index);
        }
        insert(name, index);
        return index;
    }

    private void insert(String name, int index) {
        Objects.requireNonNull(name, "name");
        mapping.putIfAbsent(name, index);
    }

    /**
     * Slot index of a name, if registered
     */
    public OptionalInt indexOf(String name) {
        Integer index = name != null ? mapping.get(name) : null;
        return index != null ? OptionalInt.of(index) : OptionalInt.empty();
    }

    public boolean contains(String name) {
        return name != null && mapping.containsKey(name);
    }

    public int size() {
        return mapping.size();
    }

    /**
     * Read-only view of all (name, index) pairs sorted by name
     */
    public Set<Map.Entry<String, Integer>> entries() {
        return Collections.unmodifiableMap(mapping).entrySet();
    }

    @Override
    public String toString() {
        return "FeatureSchema" + mapping;
    }
}

package com.geofeature.model;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Walks a feature's schema in name order and pairs each name with the
 * feature's value for that slot.
 * The schema entries are copied when the iterator is created; values are
 * read from the feature as the iterator advances.
 */
public class FeatureKvIterator implements Iterator<Map.Entry<String, AttributeValue>> {

    private final Feature feature;
    private final List<Map.Entry<String, Integer>> entries;
    private int position;

    public FeatureKvIterator(Feature feature) {
        this.feature = feature;
        this.entries = new ArrayList<>(feature.getSchema().entries());
    }

    @Override
    public boolean hasNext() {
        return position < entries.size();
    }

    @Override
    public Map.Entry<String, AttributeValue> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map.Entry<String, Integer> entry = entries.get(position++);
        return new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), feature.get(entry.getValue()));
    }
}

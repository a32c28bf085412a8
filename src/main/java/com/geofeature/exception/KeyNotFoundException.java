package com.geofeature.exception;

import java.util.NoSuchElementException;

/**
 * Thrown by a strict feature write when the key has no slot in the feature's value list
 */
public class KeyNotFoundException extends NoSuchElementException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("Key does not exist: '" + key + "'");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

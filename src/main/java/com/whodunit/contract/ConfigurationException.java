package com.whodunit.contract;

/**
 * Thrown when a game configuration cannot produce a meaningful puzzle
 * (too few names, an empty category, colliding atom keys).
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}

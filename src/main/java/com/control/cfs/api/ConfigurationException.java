package com.control.cfs.api;

/**
 * Invalid setup detected before any recursion starts: alphabet size, negative
 * truncation depth, non-positive time step, mismatched channel or field count,
 * unknown state variables.
 */
public class ConfigurationException extends ChenFliessException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

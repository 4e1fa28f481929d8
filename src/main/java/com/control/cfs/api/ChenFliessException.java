package com.control.cfs.api;

/**
 * Base type for every failure raised while building or combining Chen-Fliess
 * tables.
 *
 * All subclasses are fatal to the computation that raised them. No engine
 * returns a partially built table.
 */
public class ChenFliessException extends RuntimeException {

    public ChenFliessException(String message) {
        super(message);
    }

    public ChenFliessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.control.cfs.api;

/**
 * Raised at the boundary where two word-indexed or time-indexed structures are
 * combined and their shapes (sample count, word ordering, depth) disagree.
 */
public class ShapeMismatchException extends ChenFliessException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}

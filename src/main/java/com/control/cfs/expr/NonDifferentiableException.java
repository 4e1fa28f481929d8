package com.control.cfs.expr;

/**
 * Raised when the derivative of an expression node is undefined, e.g. the
 * derivative of {@code sign(x)}.
 */
public class NonDifferentiableException extends RuntimeException {

    public NonDifferentiableException(String message) {
        super(message);
    }
}

package com.control.cfs.expr;

import java.util.BitSet;

/** A numeric literal. */
public record Constant(double value) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return value;
    }

    @Override
    public Expr differentiate(int variableIndex) {
        return Exprs.ZERO;
    }

    @Override
    public void collectVariables(BitSet out) {
    }

    @Override
    public int precedence() {
        return value < 0 ? PREC_UNARY : PREC_ATOM;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean isZero() {
        return value == 0.0;
    }

    @Override
    public boolean isOne() {
        return value == 1.0;
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && Math.abs(value) < 1e15)
            return Long.toString((long) value);
        return Double.toString(value);
    }
}

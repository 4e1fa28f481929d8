package com.control.cfs.expr;

import java.util.BitSet;

/** A state variable z_i, identified by its position in the state vector. */
public record Variable(String name, int index) implements Expr {

    public Variable {
        if (index < 0)
            throw new IllegalArgumentException("Variable index must be >= 0, got " + index);
    }

    @Override
    public double evaluate(double[] state) {
        return state[index];
    }

    @Override
    public Expr differentiate(int variableIndex) {
        return variableIndex == index ? Exprs.ONE : Exprs.ZERO;
    }

    @Override
    public void collectVariables(BitSet out) {
        out.set(index);
    }

    @Override
    public int precedence() {
        return PREC_ATOM;
    }

    @Override
    public String toString() {
        return name;
    }
}

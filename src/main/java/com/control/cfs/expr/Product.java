package com.control.cfs.expr;

import java.util.BitSet;

/** {@code left * right}. */
public record Product(Expr left, Expr right) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return left.evaluate(state) * right.evaluate(state);
    }

    @Override
    public Expr differentiate(int variableIndex) {
        // (fg)' = f'g + fg'
        return Exprs.add(
                Exprs.mul(left.differentiate(variableIndex), right),
                Exprs.mul(left, right.differentiate(variableIndex)));
    }

    @Override
    public void collectVariables(BitSet out) {
        left.collectVariables(out);
        right.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_PRODUCT;
    }

    @Override
    public String toString() {
        return Exprs.wrap(left, PREC_PRODUCT) + "*" + Exprs.wrap(right, PREC_UNARY);
    }
}

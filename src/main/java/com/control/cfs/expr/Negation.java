package com.control.cfs.expr;

import java.util.BitSet;

/** {@code -operand}. */
public record Negation(Expr operand) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return -operand.evaluate(state);
    }

    @Override
    public Expr differentiate(int variableIndex) {
        return Exprs.neg(operand.differentiate(variableIndex));
    }

    @Override
    public void collectVariables(BitSet out) {
        operand.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_UNARY;
    }

    @Override
    public String toString() {
        return "-" + Exprs.wrap(operand, PREC_PRODUCT + 1);
    }
}

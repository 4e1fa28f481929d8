package com.control.cfs.expr;

import java.util.BitSet;

/** {@code left + right}. */
public record Sum(Expr left, Expr right) implements Expr {

    @Override
    public double evaluate(double[] state) {
        return left.evaluate(state) + right.evaluate(state);
    }

    @Override
    public Expr differentiate(int variableIndex) {
        return Exprs.add(left.differentiate(variableIndex), right.differentiate(variableIndex));
    }

    @Override
    public void collectVariables(BitSet out) {
        left.collectVariables(out);
        right.collectVariables(out);
    }

    @Override
    public int precedence() {
        return PREC_SUM;
    }

    @Override
    public String toString() {
        if (right instanceof Negation n)
            return left + " - " + Exprs.wrap(n.operand(), PREC_PRODUCT);
        if (right instanceof Constant c && c.value() < 0)
            return left + " - " + new Constant(-c.value());
        return left + " + " + right;
    }
}

package com.control.cfs.expr;

import java.util.List;

/**
 * Factory methods for {@link Expr} trees.
 *
 * Every factory performs local simplification: constant folding, removal of
 * additive zeros and multiplicative ones, annihilation by zero, and collapse
 * of double negation. Nothing beyond that; identities across subtrees are not
 * searched for.
 */
public final class Exprs {
    private Exprs() {
        // Utility class
    }

    public static final Constant ZERO = new Constant(0.0);
    public static final Constant ONE = new Constant(1.0);

    public static Expr constant(double value) {
        if (value == 0.0)
            return ZERO;
        if (value == 1.0)
            return ONE;
        return new Constant(value);
    }

    public static Variable variable(String name, int index) {
        return new Variable(name, index);
    }

    public static Expr add(Expr a, Expr b) {
        if (a.isZero())
            return b;
        if (b.isZero())
            return a;
        if (a instanceof Constant ca && b instanceof Constant cb)
            return constant(ca.value() + cb.value());
        return new Sum(a, b);
    }

    public static Expr sub(Expr a, Expr b) {
        if (b.isZero())
            return a;
        if (a.isZero())
            return neg(b);
        if (a instanceof Constant ca && b instanceof Constant cb)
            return constant(ca.value() - cb.value());
        return new Sum(a, neg(b));
    }

    public static Expr mul(Expr a, Expr b) {
        if (a.isZero() || b.isZero())
            return ZERO;
        if (a.isOne())
            return b;
        if (b.isOne())
            return a;
        if (a instanceof Constant ca && b instanceof Constant cb)
            return constant(ca.value() * cb.value());
        // Keep constants on the left so they can fold with each other
        if (b instanceof Constant && !(a instanceof Constant))
            return mul(b, a);
        if (a instanceof Constant ca) {
            if (ca.value() == -1.0)
                return neg(b);
            if (b instanceof Product p && p.left() instanceof Constant cl)
                return mul(constant(ca.value() * cl.value()), p.right());
            if (b instanceof Negation n)
                return mul(constant(-ca.value()), n.operand());
        }
        if (a instanceof Negation na && b instanceof Negation nb)
            return mul(na.operand(), nb.operand());
        return new Product(a, b);
    }

    public static Expr div(Expr a, Expr b) {
        if (b.isZero())
            throw new ArithmeticException("Division by constant zero: " + a + " / 0");
        if (a.isZero())
            return ZERO;
        if (b.isOne())
            return a;
        if (a instanceof Constant ca && b instanceof Constant cb)
            return constant(ca.value() / cb.value());
        if (b instanceof Constant cb)
            return mul(constant(1.0 / cb.value()), a);
        return new Quotient(a, b);
    }

    public static Expr pow(Expr base, double exponent) {
        if (exponent == 0.0)
            return ONE;
        if (exponent == 1.0)
            return base;
        if (base instanceof Constant c)
            return constant(Math.pow(c.value(), exponent));
        return new Power(base, exponent);
    }

    public static Expr neg(Expr a) {
        if (a instanceof Constant c)
            return constant(-c.value());
        if (a instanceof Negation n)
            return n.operand();
        return new Negation(a);
    }

    public static Expr call(Function function, Expr argument) {
        if (argument instanceof Constant c)
            return constant(function.apply(c.value()));
        return new FunctionCall(function, argument);
    }

    /** Σ terms, simplified left to right. */
    public static Expr sum(List<Expr> terms) {
        Expr acc = ZERO;
        for (Expr t : terms)
            acc = add(acc, t);
        return acc;
    }

    /** Σ a[i] * b[i]. Both arrays must have the same length. */
    public static Expr dot(Expr[] a, Expr[] b) {
        if (a.length != b.length)
            throw new IllegalArgumentException("Dot product of vectors with lengths " + a.length + " and " + b.length);
        Expr acc = ZERO;
        for (int i = 0; i < a.length; i++)
            acc = add(acc, mul(a[i], b[i]));
        return acc;
    }

    static String wrap(Expr e, int minPrecedence) {
        String s = e.toString();
        return e.precedence() < minPrecedence ? "(" + s + ")" : s;
    }
}

package com.control.cfs.expr;

import java.util.*;

/**
 * Parses infix expression text over a fixed set of state variables.
 *
 * <p>
 * Recursive descent over the grammar:
 *
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := unary (('*' | '/') unary)*
 * unary  := ('-' | '+') unary | power
 * power  := atom (('^' | '**') unary)?
 * atom   := number | name | name '(' expr ')' | '(' expr ')'
 * </pre>
 *
 * <p>
 * Supports:
 * <ul>
 * <li>Decimal and scientific number literals</li>
 * <li>Declared state variables, plus the constant {@code pi}</li>
 * <li>Functions listed in {@link Function} ({@code sin}, {@code exp}, ...)</li>
 * <li>Powers with a constant exponent</li>
 * </ul>
 */
public final class ExprParser {
    private final Map<String, Variable> variables;

    public ExprParser(List<Variable> variables) {
        Map<String, Variable> byName = new LinkedHashMap<>();
        for (Variable v : variables) {
            if (byName.put(v.name(), v) != null)
                throw new IllegalArgumentException("Duplicate variable name: " + v.name());
        }
        this.variables = byName;
    }

    /** Parses {@code text} over the given variables. */
    public static Expr parse(String text, List<Variable> variables) {
        return new ExprParser(variables).parse(text);
    }

    public Expr parse(String text) {
        if (text == null || text.isBlank())
            throw new IllegalArgumentException("Empty expression");
        Cursor c = new Cursor(text);
        Expr e = c.parseExpr();
        c.skipWS();
        if (c.pos < text.length())
            throw c.err("Unexpected '" + text.charAt(c.pos) + "'");
        return e;
    }

    private final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input) {
            this.input = input;
        }

        Expr parseExpr() {
            Expr acc = parseTerm();
            while (true) {
                skipWS();
                if (peek('+')) {
                    pos++;
                    acc = Exprs.add(acc, parseTerm());
                } else if (peek('-')) {
                    pos++;
                    acc = Exprs.sub(acc, parseTerm());
                } else
                    return acc;
            }
        }

        private Expr parseTerm() {
            Expr acc = parseUnary();
            while (true) {
                skipWS();
                if (peek('*') && !input.startsWith("**", pos)) {
                    pos++;
                    acc = Exprs.mul(acc, parseUnary());
                } else if (peek('/')) {
                    pos++;
                    int at = pos;
                    Expr denominator = parseUnary();
                    if (denominator.isZero()) {
                        pos = at;
                        throw err("Division by zero");
                    }
                    acc = Exprs.div(acc, denominator);
                } else
                    return acc;
            }
        }

        private Expr parseUnary() {
            skipWS();
            if (peek('-')) {
                pos++;
                return Exprs.neg(parseUnary());
            }
            if (peek('+')) {
                pos++;
                return parseUnary();
            }
            return parsePower();
        }

        private Expr parsePower() {
            Expr base = parseAtom();
            skipWS();
            boolean caret = peek('^');
            if (caret || input.startsWith("**", pos)) {
                pos += caret ? 1 : 2;
                int at = pos;
                Expr exponent = parseUnary();
                if (!(exponent instanceof Constant c)) {
                    pos = at;
                    throw err("Exponent must be a constant, got " + exponent);
                }
                return Exprs.pow(base, c.value());
            }
            return base;
        }

        private Expr parseAtom() {
            skipWS();
            if (pos >= input.length())
                throw err("Unexpected end");
            char ch = input.charAt(pos);
            if (ch == '(') {
                pos++;
                Expr inner = parseExpr();
                expect(')');
                return inner;
            }
            if (Character.isDigit(ch) || ch == '.')
                return parseNumber();
            if (Character.isLetter(ch) || ch == '_')
                return parseName();
            throw err("Unexpected '" + ch + "'");
        }

        private Expr parseName() {
            int s = pos;
            while (pos < input.length()
                    && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_'))
                pos++;
            String name = input.substring(s, pos);
            skipWS();
            if (peek('(')) {
                Function f = Function.fromSymbol(name);
                if (f == null) {
                    pos = s;
                    throw err("Unknown function '" + name + "'");
                }
                pos++;
                Expr arg = parseExpr();
                expect(')');
                return Exprs.call(f, arg);
            }
            Variable v = variables.get(name);
            if (v != null)
                return v;
            if (name.equals("pi"))
                return Exprs.constant(Math.PI);
            pos = s;
            throw err("Unknown variable '" + name + "', declared: " + variables.keySet());
        }

        private Expr parseNumber() {
            int s = pos;
            while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.'))
                pos++;
            if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                    pos++;
                if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                        pos++;
                } else
                    pos = mark;
            }
            String ns = input.substring(s, pos);
            try {
                return Exprs.constant(Double.parseDouble(ns));
            } catch (NumberFormatException e) {
                pos = s;
                throw err("Malformed number '" + ns + "'");
            }
        }

        private boolean peek(char c) {
            return pos < input.length() && input.charAt(pos) == c;
        }

        private void expect(char c) {
            skipWS();
            if (!peek(c))
                throw err("Expected '" + c + "'");
            pos++;
        }

        void skipWS() {
            while (pos < input.length() && " \t\n\r".indexOf(input.charAt(pos)) >= 0)
                pos++;
        }

        IllegalArgumentException err(String msg) {
            return new IllegalArgumentException(msg + " at pos " + pos + " in \"" + input + "\"");
        }
    }
}

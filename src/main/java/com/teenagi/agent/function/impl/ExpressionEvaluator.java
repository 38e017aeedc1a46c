package com.teenagi.agent.function.impl;

/**
 * Recursive-descent evaluator for plain arithmetic: + - * / %, ** or ^ for
 * powers, parentheses, unary signs and decimal literals. No variables, no
 * function calls; anything else is rejected.
 *
 * Grammar:
 *   expression := term (('+' | '-') term)*
 *   term       := unary (('*' | '/' | '%') unary)*
 *   unary      := ('+' | '-') unary | power
 *   power      := primary (('**' | '^') unary)?
 *   primary    := number | '(' expression ')'
 *
 * Powers bind tighter than a leading sign, so -2**2 is -4.
 */
public final class ExpressionEvaluator {

    private final String input;
    private int pos;

    private ExpressionEvaluator(String input) {
        this.input = input;
    }

    public static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression is empty");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double value = evaluator.expression();
        evaluator.skipWhitespace();
        if (evaluator.pos < expression.length()) {
            throw evaluator.error("Unexpected character '" + expression.charAt(evaluator.pos) + "'");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ArithmeticException("Result is not a finite number");
        }
        return value;
    }

    private double expression() {
        double value = term();
        while (true) {
            if (consume('+')) {
                value += term();
            } else if (consume('-')) {
                value -= term();
            } else {
                return value;
            }
        }
    }

    private double term() {
        double value = unary();
        while (true) {
            if (consume('*')) {
                value *= unary();
            } else if (consume('/')) {
                double divisor = unary();
                if (divisor == 0) {
                    throw new ArithmeticException("Division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = unary();
                if (divisor == 0) {
                    throw new ArithmeticException("Modulo by zero");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    private double unary() {
        if (consume('+')) {
            return unary();
        }
        if (consume('-')) {
            return -unary();
        }
        return power();
    }

    private double power() {
        double base = primary();
        if (consumePower()) {
            // right-associative: 2**3**2 is 2**9
            return Math.pow(base, unary());
        }
        return base;
    }

    private double primary() {
        skipWhitespace();
        if (consume('(')) {
            double value = expression();
            if (!consume(')')) {
                throw error("Missing closing parenthesis");
            }
            return value;
        }

        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            throw error(pos < input.length()
                    ? "Unexpected character '" + input.charAt(pos) + "'"
                    : "Unexpected end of expression");
        }
        try {
            return Double.parseDouble(input.substring(start, pos));
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + input.substring(start, pos) + "'");
        }
    }

    private boolean consumePower() {
        skipWhitespace();
        if (input.startsWith("**", pos)) {
            pos += 2;
            return true;
        }
        return consume('^');
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at position " + pos + " in: " + input);
    }
}

package com.teenagi.agent.function.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "15 * 7 + 22 / 2 | 116",
            "2 + 3 * 4       | 14",
            "(2 + 3) * 4     | 20",
            "2 ** 3 ** 2     | 512",
            "2 ^ 10          | 1024",
            "-2 ** 2         | -4",
            "10 % 4          | 2",
            "-(3 - 5)        | 2",
            "1.5 * 4         | 6"
    })
    void evaluate_arithmetic(String expression, double expected) {
        assertThat(ExpressionEvaluator.evaluate(expression)).isEqualTo(expected);
    }

    @Test
    void evaluate_divisionByZero_fails() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1 / 0"))
                .isInstanceOf(ArithmeticException.class)
                .hasMessage("Division by zero");
    }

    @Test
    void evaluate_rejectsAnythingButArithmetic() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("__import__('os')"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("2 +"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unexpected end");
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("(1 + 2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing closing parenthesis");
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void evaluate_overflow_fails() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("10 ** 400"))
                .isInstanceOf(ArithmeticException.class);
    }
}

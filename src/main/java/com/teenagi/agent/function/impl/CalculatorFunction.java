package com.teenagi.agent.function.impl;

import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.ParameterSpec;
import com.teenagi.agent.function.ParameterType;
import com.teenagi.agent.function.TypedArguments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Evaluates arithmetic expressions with {@link ExpressionEvaluator};
 * never hands the model's text to a script engine.
 */
@Component
@Slf4j
public class CalculatorFunction implements AgentFunction {

    private static final FunctionDescriptor DESCRIPTOR = FunctionDescriptor.builder()
            .name("calculate")
            .description("Calculate a mathematical expression, e.g. '15 * 7 + 22 / 2'. "
                    + "Supports + - * / %, ** for powers and parentheses.")
            .parameter(ParameterSpec.required("expression", ParameterType.STRING,
                    "The arithmetic expression to evaluate"))
            .returnType("number")
            .build();

    @Override
    public FunctionDescriptor getDescriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Object invoke(TypedArguments arguments) {
        String expression = arguments.getString("expression");
        double result = ExpressionEvaluator.evaluate(expression);
        log.debug("calculate: {} = {}", expression, result);
        return result;
    }
}

package com.teenagi.agent.function;

/**
 * Implementation half of a registered function. Receives arguments that have
 * already been validated against the function's descriptor.
 */
@FunctionalInterface
public interface FunctionInvoker {

    /**
     * @return any value; strings are handed to the model as-is, anything else as JSON
     * @throws Exception any failure, reported back to the model as an error result
     */
    Object invoke(TypedArguments arguments) throws Exception;
}

package com.teenagi.agent.function;

/**
 * A descriptor bound to its implementation; what the registry hands back on lookup.
 */
public record RegisteredFunction(FunctionDescriptor descriptor, FunctionInvoker invoker) {

    public String name() {
        return descriptor.getName();
    }
}

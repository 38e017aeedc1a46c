package com.teenagi.agent.function;

/**
 * A function that carries its own descriptor.
 *
 * Spring discovers every {@code @Component} implementing this interface and
 * registers it on the default agent at startup. Plain callers can skip this
 * and use {@link FunctionRegistry#register(FunctionDescriptor, FunctionInvoker)}.
 */
public interface AgentFunction extends FunctionInvoker {

    FunctionDescriptor getDescriptor();
}

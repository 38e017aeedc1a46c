package com.teenagi.agent.core;

import com.teenagi.agent.capability.CapabilityRegistry;
import com.teenagi.agent.function.AgentFunction;
import com.teenagi.agent.function.FunctionDescriptor;
import com.teenagi.agent.function.FunctionInvoker;
import com.teenagi.agent.function.FunctionRegistry;
import com.teenagi.agent.function.RegisteredFunction;
import com.teenagi.agent.model.AgentResponse;

import java.util.List;

/**
 * An agent: a name, what it has learned, the functions it may call, and the
 * loop that ties them to a model backend. Build one with {@link AgentFactory}.
 *
 * Safe for concurrent {@link #respond} calls; register functions before
 * traffic starts or accept that in-flight calls see either the old or the new
 * binding.
 */
public class Agent {

    private final String name;
    private final String provider;
    private final String model;
    private final CapabilityRegistry capabilities;
    private final FunctionRegistry functions;
    private final AgentLoop loop;

    public Agent(String name, String provider, String model,
                 CapabilityRegistry capabilities, FunctionRegistry functions, AgentLoop loop) {
        this.name = name;
        this.provider = provider;
        this.model = model;
        this.capabilities = capabilities;
        this.functions = functions;
        this.loop = loop;
    }

    /**
     * @return false when the statement is blank
     */
    public boolean learn(String capability) {
        return capabilities.learn(capability);
    }

    public RegisteredFunction registerFunction(FunctionDescriptor descriptor, FunctionInvoker invoker) {
        return functions.register(descriptor, invoker);
    }

    public RegisteredFunction registerFunction(AgentFunction function) {
        return functions.register(function);
    }

    /**
     * Answers a request, calling registered functions as the model proposes.
     * Blocks until the loop finishes.
     *
     * @return the final answer, or a summary of partial results when the
     *         round-trip cap was reached first
     */
    public String respond(String request) {
        return run(request).getFinalAnswer();
    }

    /** Like {@link #respond} but with the outcome, executed calls and history. */
    public AgentResponse run(String request) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be blank");
        }
        return loop.run(request);
    }

    public String getName() {
        return name;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public List<String> getCapabilities() {
        return capabilities.statements();
    }

    public List<FunctionDescriptor> getFunctions() {
        return functions.descriptors();
    }
}
